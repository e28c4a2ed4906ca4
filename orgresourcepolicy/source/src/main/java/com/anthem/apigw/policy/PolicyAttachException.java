package com.anthem.apigw.policy;

/**
 * API Gateway refused the resource policy update.
 */
public class PolicyAttachException extends RuntimeException {

    public PolicyAttachException(String message, Throwable cause) {
        super(message, cause);
    }
}
