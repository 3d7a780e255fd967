package com.demoBank.bankAssistant;

import com.demoBank.bankAssistant.session.config.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SessionProperties.class)
public class BankAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankAssistantApplication.class, args);
    }
}
