package com.resumecontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;

/**
 * ResumeControl Server Application
 *
 * Job application tracker API built with Spring Boot WebFlux
 * and R2DBC. Every resource is scoped to the owner resolved from the API key.
 */
@SpringBootApplication
@EnableR2dbcRepositories
public class ResumeControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeControlApplication.class, args);
    }

}
