package com.flagship.finance_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinanceLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FinanceLedgerApplication.class, args);
    }
}
