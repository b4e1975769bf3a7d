package org.iceforge.verdandi;

import org.iceforge.verdandi.storj.StorjProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StorjProperties.class)
public class VerdandiApplication {

	public static void main(String[] args) {
		SpringApplication.run(VerdandiApplication.class, args);
	}
}
