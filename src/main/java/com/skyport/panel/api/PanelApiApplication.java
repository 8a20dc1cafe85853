package com.skyport.panel.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PanelApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanelApiApplication.class, args);
    }
}
