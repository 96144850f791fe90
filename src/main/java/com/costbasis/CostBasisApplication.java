package com.costbasis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CostBasisApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostBasisApplication.class, args);
    }
}
