package com.purchasingpower.recordsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RecordSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecordSearchApplication.class, args);
    }
}
