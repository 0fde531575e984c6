package com.stratdsl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StratDslApplication {

    public static void main(String[] args) {
        SpringApplication.run(StratDslApplication.class, args);
    }
}
