package com.finance.audit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnomalyAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyAuditApplication.class, args);
    }
}
