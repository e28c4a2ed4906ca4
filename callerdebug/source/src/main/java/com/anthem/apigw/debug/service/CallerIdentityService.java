package com.anthem.apigw.debug.service;

import com.anthem.apigw.debug.model.CallerIdentity;
import com.anthem.apigw.debug.model.IdentityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.SdkHttpResponse;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves the identity behind the current AWS credentials with STS GetCallerIdentity.
 * Failures of any kind (transport, service rejection, timeout) come back as
 * {@link IdentityResult.Failed} instead of being thrown.
 */
public class CallerIdentityService {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityService.class);

    private static final String REQUEST_ID_HEADER = "x-amzn-RequestId";

    private final StsClient stsClient;

    public CallerIdentityService(StsClient stsClient) {
        this.stsClient = stsClient;
    }

    public IdentityResult resolve() {
        try {
            GetCallerIdentityResponse response = stsClient.getCallerIdentity(GetCallerIdentityRequest.builder().build());
            if (response == null) {
                throw new IllegalStateException("Empty response from STS GetCallerIdentity");
            }
            return IdentityResult.resolved(toCallerIdentity(response));
        } catch (RuntimeException e) {
            log.debug("GetCallerIdentity failed: {}", e.toString());
            return IdentityResult.failed(e);
        }
    }

    private CallerIdentity toCallerIdentity(GetCallerIdentityResponse response) {
        return CallerIdentity.builder()
                .accountId(response.account())
                .arn(response.arn())
                .userId(response.userId())
                .metadata(metadata(response.sdkHttpResponse()))
                .build();
    }

    private Map<String, Object> metadata(SdkHttpResponse httpResponse) {
        if (httpResponse == null) {
            return null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("httpStatusCode", httpResponse.statusCode());
        httpResponse.firstMatchingHeader(REQUEST_ID_HEADER)
                .ifPresent(requestId -> metadata.put("requestId", requestId));
        return metadata;
    }
}
