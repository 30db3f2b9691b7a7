package com.example.bugstream.stream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-time bug stream service: clients connect over WebSocket, subscribe to stream types with
 * filters, and receive bug and analytics events pushed from the ingestion queues.
 */
@SpringBootApplication(scanBasePackages = "com.example.bugstream")
public class BugStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(BugStreamApplication.class, args);
    }
}
