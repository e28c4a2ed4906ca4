package com.anthem.apigw.debug.config;

import com.anthem.apigw.debug.service.CallerIdentityService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * STS wiring for the Spring Boot hosted diagnostic endpoint.
 */
@Configuration
public class StsConfiguration {

    @Value("${apigw.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${apigw.aws.sts-endpoint:}")
    private String stsEndpoint;

    @Value("${apigw.aws.sts-call-timeout-ms:5000}")
    private long callTimeoutMs;

    @Bean
    public StsClient stsClient() {
        return StsClients.create(awsRegion, stsEndpoint, callTimeoutMs);
    }

    @Bean
    public CallerIdentityService callerIdentityService(StsClient stsClient) {
        return new CallerIdentityService(stsClient);
    }
}
