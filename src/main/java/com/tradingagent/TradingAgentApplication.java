package com.tradingagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradingAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradingAgentApplication.class, args);
    }
}
