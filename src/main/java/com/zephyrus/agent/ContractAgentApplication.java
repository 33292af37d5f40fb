package com.zephyrus.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContractAgentApplication.class, args);
    }
}
