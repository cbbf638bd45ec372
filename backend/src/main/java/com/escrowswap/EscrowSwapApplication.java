package com.escrowswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EscrowSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowSwapApplication.class, args);
    }
}
