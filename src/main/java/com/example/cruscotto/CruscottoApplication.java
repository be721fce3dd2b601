package com.example.cruscotto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point.
 * This class only wires the application context; acquisition, extraction and query services live
 * in the application layer and are exposed through the interfaces layer.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class CruscottoApplication {

	/**
	 * Boots the Spring container, the scheduled monthly update and the query endpoints.
	 *
	 * @param args optional command line arguments passed by the JVM
	 */
	public static void main(String[] args) {
		SpringApplication.run(CruscottoApplication.class, args);
	}

}
