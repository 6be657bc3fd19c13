package com.di.countnova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CountNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(CountNovaApplication.class, args);
	}
}
