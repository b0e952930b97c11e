package com.study.webflux.historian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HistorianExtractorApplication {

	public static void main(String[] args) {
		SpringApplication.run(HistorianExtractorApplication.class, args);
	}
}
