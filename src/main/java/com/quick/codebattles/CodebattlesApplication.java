package com.quick.codebattles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CodebattlesApplication {

	public static void main(String[] args) {
		SpringApplication.run(CodebattlesApplication.class, args);
	}

}
