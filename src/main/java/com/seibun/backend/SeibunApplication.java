package com.seibun.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SeibunApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(SeibunApplication.class, args)));
	}

}
