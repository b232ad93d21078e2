package com.powerlevel.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PowerlevelTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PowerlevelTrackerApplication.class, args);
    }
}
