package com.purchasingpower.agentmail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMailApplication.class, args);
    }
}
