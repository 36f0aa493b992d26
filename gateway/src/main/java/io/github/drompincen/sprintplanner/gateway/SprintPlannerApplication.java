package io.github.drompincen.sprintplanner.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.sprintplanner")
@EnableMongoRepositories(basePackages = "io.github.drompincen.sprintplanner.persistence.repository")
@ConfigurationPropertiesScan(basePackages = "io.github.drompincen.sprintplanner.runtime")
public class SprintPlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SprintPlannerApplication.class, args);
    }
}
