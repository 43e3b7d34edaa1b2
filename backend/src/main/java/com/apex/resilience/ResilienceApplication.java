package com.apex.resilience;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ResilienceApplication {
	public static void main(String[] args) {
		SpringApplication.run(ResilienceApplication.class, args);
	}
}
