package com.cliniq.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.cliniq.engine")
@EnableJpaRepositories(basePackages = "com.cliniq.engine.repository")
@EntityScan(basePackages = "com.cliniq.engine.entity")
@EnableScheduling
public class CliniqEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliniqEngineApplication.class, args);
    }
}
