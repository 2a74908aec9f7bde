package com.reflow.ocr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ReflowOcrApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReflowOcrApplication.class, args);
	}
}
