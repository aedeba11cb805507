package com.enterprise.sqlbind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SqlBindApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlBindApplication.class, args);
    }
}
