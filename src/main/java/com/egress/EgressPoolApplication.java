package com.egress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EgressPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(EgressPoolApplication.class, args);
    }
}
