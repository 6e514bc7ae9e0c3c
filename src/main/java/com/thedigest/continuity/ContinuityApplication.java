package com.thedigest.continuity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContinuityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContinuityApplication.class, args);
    }
}
