package com.anthem.apigw.debug.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * API Gateway Lambda proxy integration response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyResponse {

    private int statusCode;

    private Map<String, String> headers;

    private String body;

    /**
     * Exposed as isBase64Encoded, the name API Gateway reads.
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean base64Encoded;

    public boolean getIsBase64Encoded() {
        return base64Encoded;
    }

    public void setIsBase64Encoded(boolean base64Encoded) {
        this.base64Encoded = base64Encoded;
    }
}
