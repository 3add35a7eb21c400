package com.example.shortvideo_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ShortVideoBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortVideoBackendApplication.class, args);
	}

}
