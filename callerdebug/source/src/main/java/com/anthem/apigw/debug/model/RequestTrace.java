package com.anthem.apigw.debug.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * What was received on the diagnostic endpoint, logged once per request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestTrace {

    private Map<String, String> headers;

    private String url;

    private String method;

    /**
     * Caller metadata supplied by the hosting boundary, absent when there is none.
     */
    private Map<String, Object> trustContext;

    public static RequestTrace fromProxyRequest(ProxyRequest request) {
        Map<String, String> headers = request.getHeaders() != null ? request.getHeaders() : Map.of();
        return RequestTrace.builder()
                .headers(headers)
                .url(buildUrl(headers, request.getPath(), request.getQueryStringParameters()))
                .method(request.getHttpMethod())
                .trustContext(request.getRequestContext())
                .build();
    }

    private static String buildUrl(Map<String, String> headers, String path, Map<String, String> query) {
        StringBuilder url = new StringBuilder();
        String host = header(headers, "Host");
        if (host != null) {
            String proto = header(headers, "X-Forwarded-Proto");
            url.append(proto != null ? proto : "https").append("://").append(host);
        }
        url.append(path != null ? path : "/");
        if (query != null && !query.isEmpty()) {
            url.append('?').append(query.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining("&")));
        }
        return url.toString();
    }

    private static String header(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (name.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
