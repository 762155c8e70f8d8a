package com.sashkomusic.catalogingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SmCatalogIngestApplication {

	public static void main(String[] args) {
		SpringApplication.run(SmCatalogIngestApplication.class, args);
	}

}
