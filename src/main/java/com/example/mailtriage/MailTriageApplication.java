package com.example.mailtriage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailTriageApplication {

	public static void main(String[] args) {
		SpringApplication.run(MailTriageApplication.class, args);
	}

}
