package com.chaintruth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainTruthApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainTruthApplication.class, args);
    }
}
