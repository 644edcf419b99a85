package com.call_bridge_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CallBridgeBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(CallBridgeBackendApplication.class, args);
	}

}
