package com.demanddna;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DemandDnaApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemandDnaApplication.class, args);
    }
}
