package com.koni.sensordata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorDataApplication {

	public static void main(String[] args) {
		SpringApplication.run(SensorDataApplication.class, args);
	}

}
