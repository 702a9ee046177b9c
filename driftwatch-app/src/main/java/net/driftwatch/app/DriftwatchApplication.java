package net.driftwatch.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DriftwatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(DriftwatchApplication.class, args);
    }
}
