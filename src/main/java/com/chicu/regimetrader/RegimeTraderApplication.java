package com.chicu.regimetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.regimetrader")
public class RegimeTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegimeTraderApplication.class, args);
    }
}
