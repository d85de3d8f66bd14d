package com.studioledger.backup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudioBackupApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudioBackupApplication.class, args);
    }
}
