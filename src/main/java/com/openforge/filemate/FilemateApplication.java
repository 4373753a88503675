package com.openforge.filemate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FilemateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilemateApplication.class, args);
    }
}
