package com.architecture.memory.recall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeRecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeRecallApplication.class, args);
    }
}
