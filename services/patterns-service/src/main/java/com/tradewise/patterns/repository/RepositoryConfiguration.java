package com.tradewise.patterns.repository;

import com.tradewise.common.domain.Account;
import com.tradewise.common.domain.LedgerEntry;
import com.tradewise.common.domain.Order;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Instant;

@Configuration
public class RepositoryConfiguration {

    public static final String SEEDED_ACCOUNT_ID = "ACC-001";

    @Bean
    public Repository<Order, String> orderStore() {
        return new InMemoryRepository<>(Order::getOrderId);
    }

    @Bean
    public Repository<Account, String> accountRepository() {
        Repository<Account, String> accounts = new InMemoryRepository<>(Account::accountId);
        accounts.add(new Account(SEEDED_ACCOUNT_ID, "Test Account", new BigDecimal("100000"), "USD", Instant.now()));
        return accounts;
    }

    @Bean
    public Repository<LedgerEntry, String> ledgerRepository() {
        return new InMemoryRepository<>(LedgerEntry::entryId);
    }
}
