package com.agentloop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentloopApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentloopApplication.class, args);
    }
}
