package com.eainde.literature;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiteraturePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiteraturePipelineApplication.class, args);
    }
}
