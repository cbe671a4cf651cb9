package com.bbthechange.carshare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class CarShareApplication {

	private static final Logger logger = LoggerFactory.getLogger(CarShareApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(CarShareApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Car sharing backend listening on port {} (REST and /ws channel)", event.getWebServer().getPort());
	}
}
