package com.anthem.apigw.debug.service;

import com.anthem.apigw.debug.model.DiagnosticResult;
import com.anthem.apigw.debug.model.IdentityResult;
import com.anthem.apigw.debug.model.RequestTrace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core of the GET /debug endpoint: traces the request, resolves the caller identity
 * and shapes the 200 or 500 response body. Never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosticReporter {

    public static final String SUCCESS_MESSAGE =
            "Lambda executed successfully. Check CloudWatch logs for caller identity details.";
    public static final String FAILURE_MESSAGE = "Error retrieving caller identity";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final CallerIdentityService callerIdentityService;

    public DiagnosticResult report(RequestTrace trace) {
        try {
            logTrace(trace);

            IdentityResult result = callerIdentityService.resolve();
            if (result instanceof IdentityResult.Resolved) {
                IdentityResult.Resolved resolved = (IdentityResult.Resolved) result;
                log.info("Caller Identity: {}", resolved.getIdentity());
                return success(resolved);
            }

            IdentityResult.Failed failed = (IdentityResult.Failed) result;
            log.error("Error retrieving caller identity: {}", failed.getErrorMessage(), failed.getCause());
            return failure(failed.getErrorMessage());

        } catch (Exception e) {
            String message = IdentityResult.normalize(e);
            log.error("Error retrieving caller identity: {}", message, e);
            return failure(message);
        }
    }

    private void logTrace(RequestTrace trace) {
        try {
            log.info("Received request: {}", MAPPER.writeValueAsString(trace));
        } catch (JsonProcessingException e) {
            log.info("Received request: {}", trace);
        }
    }

    private DiagnosticResult success(IdentityResult.Resolved resolved) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", SUCCESS_MESSAGE);
        body.put("callerIdentity", resolved.getIdentity());
        return new DiagnosticResult(200, body);
    }

    private DiagnosticResult failure(String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", FAILURE_MESSAGE);
        body.put("error", error);
        return new DiagnosticResult(500, body);
    }
}
