package dev.configkit.examples.webapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WebApiSampleApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebApiSampleApplication.class, args);
    }
}
