package my.charbuilder.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CharBuilderApplication {

	public static void main(String[] args) {
		SpringApplication.run(CharBuilderApplication.class, args);
	}
}
