package com.sandkev.holdings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.sandkev.holdings.config")
public class HoldingsApplication {

	public static void main(String[] args) {
		SpringApplication.run(HoldingsApplication.class, args);
	}

}
