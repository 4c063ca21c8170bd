package com.flagship.coop_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoopLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoopLedgerApplication.class, args);
    }
}
