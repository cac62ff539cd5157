package com.spreadsheet.drilldown;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DrillDownApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrillDownApplication.class, args);
    }
}
