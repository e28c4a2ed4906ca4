package com.anthem.apigw.debug.controller;

import com.anthem.apigw.debug.model.DiagnosticResult;
import com.anthem.apigw.debug.model.RequestTrace;
import com.anthem.apigw.debug.service.DiagnosticReporter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /debug for container hosting (EKS with IRSA), same contract as the Lambda handler.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class DebugController {

    /**
     * Headers a fronting load balancer or API Gateway VPC link sets about the caller.
     */
    private static final List<String> TRUST_HEADERS = List.of(
            "X-Amzn-Trace-Id", "X-Forwarded-For", "X-Amzn-Apigateway-Api-Id", "X-Amzn-Vpce-Id");

    private final DiagnosticReporter diagnosticReporter;

    @GetMapping("/debug")
    public ResponseEntity<Map<String, Object>> debug(HttpServletRequest request) {
        DiagnosticResult result = diagnosticReporter.report(toTrace(request));
        log.debug("GET /debug completed: status={}", result.getStatusCode());
        return ResponseEntity.status(result.getStatusCode()).body(result.getBody());
    }

    private RequestTrace toTrace(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }

        StringBuilder url = new StringBuilder(request.getRequestURL());
        if (request.getQueryString() != null) {
            url.append('?').append(request.getQueryString());
        }

        Map<String, Object> trustContext = new LinkedHashMap<>();
        for (String name : TRUST_HEADERS) {
            String value = request.getHeader(name);
            if (value != null) {
                trustContext.put(name, value);
            }
        }

        return RequestTrace.builder()
                .headers(headers)
                .url(url.toString())
                .method(request.getMethod())
                .trustContext(trustContext.isEmpty() ? null : trustContext)
                .build();
    }
}
