package com.anthem.apigw.debug;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Caller Debug Service
 *
 * Standalone host for GET /debug, for deployments where the diagnostic endpoint
 * runs as a container instead of behind API Gateway as a Lambda function
 * (see {@link CallerIdentityHandler}).
 */
@SpringBootApplication
public class DebugApplication {

    public static void main(String[] args) {
        SpringApplication.run(DebugApplication.class, args);
    }
}
