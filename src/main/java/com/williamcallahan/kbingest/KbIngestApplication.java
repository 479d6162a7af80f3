package com.williamcallahan.kbingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KbIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbIngestApplication.class, args);
    }

}
