package com.chunkanon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ChunkAnonymizer - PII anonymization of X_1 conversation chunk files.
 */
@SpringBootApplication
public class ChunkAnonymizerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(ChunkAnonymizerApplication.class, args)));
	}

}
