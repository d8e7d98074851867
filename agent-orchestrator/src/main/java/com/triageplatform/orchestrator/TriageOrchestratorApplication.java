package com.triageplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.triageplatform")
public class TriageOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageOrchestratorApplication.class, args);
    }
}
