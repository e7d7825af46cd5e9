package com.tony.propsAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PropsAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(PropsAnalyticsApplication.class, args);
	}

}
