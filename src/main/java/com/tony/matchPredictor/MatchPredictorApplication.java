package com.tony.matchPredictor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MatchPredictorApplication {

	public static void main(String[] args) {
		SpringApplication.run(MatchPredictorApplication.class, args);
	}

}
