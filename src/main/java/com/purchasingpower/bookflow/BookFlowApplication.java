package com.purchasingpower.bookflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BookFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookFlowApplication.class, args);
    }
}
