package com.dockerlab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
@EnableRetry
@Slf4j
public class DockerLabApplication {
    public static void main(String[] args) {
        SpringApplication.run(DockerLabApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("Application is shutting down. Closing store connections...");
    }
}
