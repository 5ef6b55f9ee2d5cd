package com.redarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RedarmApplication {

    public static void main(String[] args) {
        SpringApplication.run(RedarmApplication.class, args);
    }
}
