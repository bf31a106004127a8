package dev.careeriq;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CareerIqApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareerIqApplication.class, args);
    }
}
