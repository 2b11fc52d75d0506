package com.roomrank.roomrank_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RoomrankApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoomrankApiApplication.class, args);
	}

}
