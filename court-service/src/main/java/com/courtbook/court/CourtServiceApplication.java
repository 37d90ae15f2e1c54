package com.courtbook.court;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@OpenAPIDefinition(info = @Info(
        title = "Court Service API",
        description = "Court availability, price rules and holiday calendar",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.courtbook.court", "com.courtbook.common"})
public class CourtServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourtServiceApplication.class, args);
    }
}
