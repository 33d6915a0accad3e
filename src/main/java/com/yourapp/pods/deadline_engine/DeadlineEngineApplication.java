package com.yourapp.pods.deadline_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeadlineEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeadlineEngineApplication.class, args);
    }

}
