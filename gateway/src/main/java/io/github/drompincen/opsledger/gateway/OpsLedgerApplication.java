package io.github.drompincen.opsledger.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.opsledger")
@EnableMongoRepositories(basePackages = "io.github.drompincen.opsledger.persistence.repository")
@EnableScheduling
public class OpsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsLedgerApplication.class, args);
    }
}
