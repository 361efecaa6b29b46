package com.dndforge.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Spring Boot Application для сборки персонажей
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.dndforge")
public class CharacterBuilderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CharacterBuilderApplication.class, args);
    }
}
