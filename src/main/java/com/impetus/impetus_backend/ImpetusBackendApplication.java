package com.impetus.impetus_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImpetusBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImpetusBackendApplication.class, args);
    }
}
