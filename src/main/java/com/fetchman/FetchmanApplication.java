package com.fetchman;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FetchmanApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(FetchmanApplication.class);
        app.setWebApplicationType(WebApplicationType.REACTIVE);
        app.run(args);
	}

}
