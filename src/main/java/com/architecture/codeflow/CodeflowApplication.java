package com.architecture.codeflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeflowApplication.class, args);
    }
}
