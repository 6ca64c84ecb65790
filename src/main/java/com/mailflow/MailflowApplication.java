package com.mailflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailflowApplication.class, args);
    }
}
