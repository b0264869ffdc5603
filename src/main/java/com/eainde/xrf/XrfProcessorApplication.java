package com.eainde.xrf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XrfProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(XrfProcessorApplication.class, args);
    }
}
