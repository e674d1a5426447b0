package com.gdin.inspection.semanticrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SemanticRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(SemanticRouterApplication.class, args);
    }
}
