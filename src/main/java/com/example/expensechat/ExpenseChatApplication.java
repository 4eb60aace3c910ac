package com.example.expensechat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ExpenseChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpenseChatApplication.class, args);
    }

}
