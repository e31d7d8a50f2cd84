package com.nestegg.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// Callers are identified by bearer token only; no local user store.
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class NestEggApplication {
	public static void main(String[] args) {
		SpringApplication.run(NestEggApplication.class, args);
	}
}
