package com.openforge.taskmate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TaskmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskmateApplication.class, args);
    }
}
