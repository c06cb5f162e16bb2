package com.incident.rca;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IncidentRcaApplication {

    public static void main(String[] args) {
        SpringApplication.run(IncidentRcaApplication.class, args);
    }
}
