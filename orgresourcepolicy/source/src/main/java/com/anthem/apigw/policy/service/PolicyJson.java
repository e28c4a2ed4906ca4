package com.anthem.apigw.policy.service;

import com.anthem.apigw.policy.model.PolicyDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON form of a {@link PolicyDocument}, as API Gateway expects it in the REST API policy field.
 */
public class PolicyJson {

    private final ObjectMapper objectMapper;

    public PolicyJson() {
        this(new ObjectMapper());
    }

    public PolicyJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(PolicyDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize resource policy", e);
        }
    }

    public PolicyDocument read(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, PolicyDocument.class);
    }
}
