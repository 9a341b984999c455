package com.example.pdflayout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Application entry point. Wires the extraction and reconstruction services behind the HTTP endpoints
 * defined under the interfaces layer.
 */
@SpringBootApplication
public class PdfLayoutApplication {

	public static void main(String[] args) {
		SpringApplication.run(PdfLayoutApplication.class, args);
	}

}
