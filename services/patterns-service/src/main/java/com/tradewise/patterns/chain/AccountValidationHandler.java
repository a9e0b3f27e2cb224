package com.tradewise.patterns.chain;

import com.tradewise.common.domain.Account;
import com.tradewise.common.domain.Order;
import com.tradewise.patterns.repository.Repository;

import java.util.List;

/**
 * Rejects orders whose account is unknown.
 */
public class AccountValidationHandler extends AbstractValidationHandler {

    private final Repository<Account, String> accountRepository;

    public AccountValidationHandler(Repository<Account, String> accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    protected String getHandlerName() {
        return "Account";
    }

    @Override
    protected List<String> validate(Order order) {
        if (order.getAccountId() == null || !accountRepository.exists(order.getAccountId())) {
            return List.of("Account " + order.getAccountId() + " not found");
        }
        return List.of();
    }
}
