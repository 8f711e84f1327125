package fr.imt.stackpilot.stackpilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableFeignClients(basePackages = "fr.imt.stackpilot.stackpilot")
@EnableScheduling
public class StackpilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(StackpilotApplication.class, args);
    }

}
