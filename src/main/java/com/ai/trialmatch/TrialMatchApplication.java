package com.ai.trialmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrialMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrialMatchApplication.class, args);
    }
}
