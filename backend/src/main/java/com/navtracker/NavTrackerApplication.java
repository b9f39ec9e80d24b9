package com.navtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NavTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NavTrackerApplication.class, args);
    }
}
