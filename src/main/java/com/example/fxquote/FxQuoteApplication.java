package com.example.fxquote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FxQuoteApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxQuoteApplication.class, args);
    }
}
