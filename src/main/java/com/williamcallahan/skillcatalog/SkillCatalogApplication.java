package com.williamcallahan.skillcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SkillCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillCatalogApplication.class, args);
    }

}
