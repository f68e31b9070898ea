package com.daoindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DaoIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DaoIndexerApplication.class, args);
    }
}
