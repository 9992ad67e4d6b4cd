package com.controlsdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ControlsDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ControlsDashboardApplication.class, args);
    }
}
