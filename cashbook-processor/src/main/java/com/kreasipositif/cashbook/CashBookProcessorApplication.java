package com.kreasipositif.cashbook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class CashBookProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CashBookProcessorApplication.class, args);
    }
}
