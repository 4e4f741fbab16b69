package com.clapgrow.mediarelay.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaRelayWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(MediaRelayWorkerApplication.class, args);
    }
}
