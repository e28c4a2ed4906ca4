package com.anthem.apigw.debug.model;

import lombok.Data;

import java.util.Map;

/**
 * API Gateway Lambda proxy integration request.
 */
@Data
public class ProxyRequest {

    private String resource;

    private String path;

    private String httpMethod;

    private Map<String, String> headers;

    private Map<String, String> queryStringParameters;

    private Map<String, String> pathParameters;

    private Map<String, String> stageVariables;

    /**
     * Request context added by API Gateway: request id, stage, and the caller
     * identity block (IAM caller ARN, account id, source IP) or authorizer output.
     */
    private Map<String, Object> requestContext;

    private String body;
}
