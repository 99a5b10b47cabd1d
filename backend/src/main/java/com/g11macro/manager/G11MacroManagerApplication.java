package com.g11macro.manager;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class G11MacroManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(G11MacroManagerApplication.class, args);
    }
}
