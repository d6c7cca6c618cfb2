package com.xksgroup.streamarchiver;

import com.xksgroup.streamarchiver.config.ArchiverProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ArchiverProperties.class)
public class StreamArchiverApplication {
    public static void main(String[] args) {
        SpringApplication.run(StreamArchiverApplication.class, args);
    }
}
