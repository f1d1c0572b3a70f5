package com.cadastral.lookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CadastralLookupApplication {

    public static void main(String[] args) {
        SpringApplication.run(CadastralLookupApplication.class, args);
    }
}
