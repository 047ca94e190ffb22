package com.streamfirst.ddns.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BridgeProperties.class)
public class DdnsBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(DdnsBridgeApplication.class, args);
    }
}
