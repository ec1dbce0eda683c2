package com.work.bonding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口操作账本。
 */
@SpringBootApplication
public class BondingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BondingLedgerApplication.class, args);
    }
}
