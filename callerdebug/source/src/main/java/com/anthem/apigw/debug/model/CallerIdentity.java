package com.anthem.apigw.debug.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Identity of the credentials this process runs with, as resolved by STS.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallerIdentity {

    private String accountId;

    private String arn;

    private String userId;

    /**
     * Response metadata passed through from STS (request id, HTTP status).
     */
    private Map<String, Object> metadata;
}
