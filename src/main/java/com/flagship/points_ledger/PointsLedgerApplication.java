package com.flagship.points_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PointsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PointsLedgerApplication.class, args);
    }
}
