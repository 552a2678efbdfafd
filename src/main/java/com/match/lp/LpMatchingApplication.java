package com.match.lp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LpMatchingApplication {

	public static void main(String[] args) {
		SpringApplication.run(LpMatchingApplication.class, args);
	}

}
