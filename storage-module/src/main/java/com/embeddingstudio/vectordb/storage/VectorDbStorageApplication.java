package com.embeddingstudio.vectordb.storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VectorDbStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(VectorDbStorageApplication.class, args);
    }
}
