package com.dimensio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dimensio - structured value extraction service.
 */
@SpringBootApplication
public class DimensioApplication {

	public static void main(String[] args) {
		SpringApplication.run(DimensioApplication.class, args);
	}

}
