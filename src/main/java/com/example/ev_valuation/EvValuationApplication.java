package com.example.ev_valuation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EvValuationApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvValuationApplication.class, args);
    }
}
