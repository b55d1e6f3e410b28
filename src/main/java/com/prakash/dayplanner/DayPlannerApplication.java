package com.prakash.dayplanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Daily pre-computation of suggested plans
public class DayPlannerApplication {

	public static void main(String[] args) {
		SpringApplication.run(DayPlannerApplication.class, args);
	}

}
