package com.roundtrip.server;

import com.roundtrip.common.properties.ItineraryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ItineraryProperties.class)
public class RoundtripServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoundtripServerApplication.class, args);
    }
}
