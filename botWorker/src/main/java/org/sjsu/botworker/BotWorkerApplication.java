package org.sjsu.botworker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BotWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotWorkerApplication.class, args);
    }
}
