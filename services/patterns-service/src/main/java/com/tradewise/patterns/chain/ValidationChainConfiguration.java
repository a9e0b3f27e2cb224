package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Account;
import com.tradewise.patterns.config.PatternsProperties;
import com.tradewise.patterns.repository.Repository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ValidationChainConfiguration {

    /**
     * Basic -> Risk -> Account.
     */
    @Bean
    public ValidationHandler orderValidationChain(PatternsProperties properties,
                                                  Repository<Account, String> accountRepository) {
        ValidationHandler basic = new BasicValidationHandler();
        basic.setNext(new RiskValidationHandler(properties.getChain().getMaxOrderValue()))
            .setNext(new AccountValidationHandler(accountRepository));
        return basic;
    }
}
