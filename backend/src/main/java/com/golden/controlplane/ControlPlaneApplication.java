package com.golden.controlplane;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ControlPlaneApplication {
	public static void main(String[] args) {
		SpringApplication.run(ControlPlaneApplication.class, args);
	}
}
