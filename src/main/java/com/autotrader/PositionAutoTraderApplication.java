package com.autotrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PositionAutoTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(PositionAutoTraderApplication.class, args);
    }
}
