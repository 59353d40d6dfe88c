package com.apunto.roster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MsProfileSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MsProfileSyncApplication.class, args);
    }
}
