package com.ogt.jobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OgtJobServiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(OgtJobServiceApplication.class, args);
	}

}
