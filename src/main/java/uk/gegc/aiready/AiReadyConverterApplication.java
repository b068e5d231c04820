package uk.gegc.aiready;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AiReadyConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AiReadyConverterApplication.class, args);
    }
}
