package com.scenepilot.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScenePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScenePilotApplication.class, args);
    }
}
