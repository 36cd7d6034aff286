package com.autofurigana;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AutoFurigana - Japanese reading annotation service.
 */
@SpringBootApplication
public class AutoFuriganaApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoFuriganaApplication.class, args);
	}

}
