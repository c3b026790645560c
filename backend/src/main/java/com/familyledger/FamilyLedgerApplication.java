package com.familyledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FamilyLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FamilyLedgerApplication.class, args);
    }
}
