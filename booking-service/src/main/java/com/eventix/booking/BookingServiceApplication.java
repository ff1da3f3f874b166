package com.eventix.booking;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@OpenAPIDefinition(info = @Info(
        title = "Booking Service API",
        description = "Ticket booking with stacked discounts, payment proof review and automatic expiry",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.eventix.booking", "com.eventix.common"})
@EnableScheduling
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
