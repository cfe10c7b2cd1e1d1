package org.example.cryoingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryoIngestApplication {
    public static void main(String[] args) {
        SpringApplication.run(CryoIngestApplication.class, args);
    }
}
