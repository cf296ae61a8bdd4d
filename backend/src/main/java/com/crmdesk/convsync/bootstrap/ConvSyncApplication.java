package com.crmdesk.convsync.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.crmdesk.convsync")
public class ConvSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(ConvSyncApplication.class, args);
    }
}
