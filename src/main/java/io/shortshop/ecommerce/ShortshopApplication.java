package io.shortshop.ecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan  // AppProperties (shortshop.app.*)
public class ShortshopApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortshopApplication.class, args);
	}

}
