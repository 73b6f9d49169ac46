package com.walletwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WalletWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WalletWatchApplication.class, args);
    }
}
