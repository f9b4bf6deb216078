package com.trustmail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustMailApplication.class, args);
    }
}
