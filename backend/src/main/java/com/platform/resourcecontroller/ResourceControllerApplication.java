package com.platform.resourcecontroller;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Resource Controller Application
 * 
 * Reconciles desired resource records against the systems that own them and
 * late-initializes optional fields from what those systems report back:
 * - Declarative per-type late-initialization rulesets
 * - Durable pending marker with backoff requeues
 * - Minimal spec/status patches with optimistic locking
 */
@SpringBootApplication
@EnableScheduling
public class ResourceControllerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResourceControllerApplication.class, args);
    }
}
