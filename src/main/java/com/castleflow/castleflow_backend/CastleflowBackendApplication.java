package com.castleflow.castleflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CastleflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CastleflowBackendApplication.class, args);
    }
}
