package com.anthem.apigw.policy.service;

import com.anthem.apigw.policy.PolicyAttachException;
import com.anthem.apigw.policy.model.PolicyDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.Op;
import software.amazon.awssdk.services.apigateway.model.PatchOperation;
import software.amazon.awssdk.services.apigateway.model.UpdateRestApiRequest;

/**
 * Writes a resource policy into the policy field of an API Gateway REST API.
 */
public class RestApiPolicyAttacher {

    private static final Logger log = LoggerFactory.getLogger(RestApiPolicyAttacher.class);

    static final String POLICY_PATH = "/policy";

    private final ApiGatewayClient apiGatewayClient;
    private final PolicyJson policyJson;

    public RestApiPolicyAttacher(String region) {
        this(ApiGatewayClient.builder()
                .region(Region.of(region))
                .build(), new PolicyJson());
    }

    // For testing
    public RestApiPolicyAttacher(ApiGatewayClient apiGatewayClient, PolicyJson policyJson) {
        this.apiGatewayClient = apiGatewayClient;
        this.policyJson = policyJson;
    }

    public void attach(String restApiId, PolicyDocument policy) {
        String json = policyJson.write(policy);

        UpdateRestApiRequest request = UpdateRestApiRequest.builder()
                .restApiId(restApiId)
                .patchOperations(PatchOperation.builder()
                        .op(Op.REPLACE)
                        .path(POLICY_PATH)
                        .value(json)
                        .build())
                .build();

        try {
            apiGatewayClient.updateRestApi(request);
        } catch (SdkException e) {
            log.error("Failed to attach resource policy: restApiId={}", restApiId, e);
            throw new PolicyAttachException("Failed to attach resource policy to API " + restApiId, e);
        }

        log.info("Resource policy \"{}\" added to API \"{}\".", json, restApiId);
    }
}
