package com.apex.riskcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RiskCoreApplication {
	public static void main(String[] args) {
		SpringApplication.run(RiskCoreApplication.class, args);
	}
}
