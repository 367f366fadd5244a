package com.driftops;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DriftOpsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftOpsApplication.class, args);
    }
}
