package com.polpas.orderbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;

@SpringBootApplication
@EntityScan(basePackages = {"com.polpas.orderbot.model", "com.polpas.orderbot.util"})
public class OrderBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderBotApplication.class, args);
    }
}
