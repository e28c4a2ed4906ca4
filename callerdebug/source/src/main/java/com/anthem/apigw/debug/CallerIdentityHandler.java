package com.anthem.apigw.debug;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.anthem.apigw.debug.config.StsClients;
import com.anthem.apigw.debug.model.DiagnosticResult;
import com.anthem.apigw.debug.model.IdentityResult;
import com.anthem.apigw.debug.model.ProxyRequest;
import com.anthem.apigw.debug.model.ProxyResponse;
import com.anthem.apigw.debug.model.RequestTrace;
import com.anthem.apigw.debug.service.CallerIdentityService;
import com.anthem.apigw.debug.service.DiagnosticReporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * AWS Lambda handler for GET /debug behind API Gateway.
 * Logs the request and returns the caller identity resolved by STS, or a 500
 * body describing why it could not be resolved.
 */
public class CallerIdentityHandler implements RequestHandler<ProxyRequest, ProxyResponse> {

    private static final Logger log = LoggerFactory.getLogger(CallerIdentityHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, String> JSON_HEADERS = Map.of("Content-Type", "application/json");

    private final DiagnosticReporter reporter;

    public CallerIdentityHandler() {
        this(new DiagnosticReporter(new CallerIdentityService(StsClients.shared())));
    }

    // For testing
    public CallerIdentityHandler(DiagnosticReporter reporter) {
        this.reporter = reporter;
    }

    @Override
    public ProxyResponse handleRequest(ProxyRequest request, Context context) {
        if (context != null) {
            log.debug("Invocation: awsRequestId={}", context.getAwsRequestId());
        }

        DiagnosticResult result;
        try {
            result = reporter.report(RequestTrace.fromProxyRequest(request != null ? request : new ProxyRequest()));
        } catch (Exception e) {
            log.error("Unexpected diagnostic failure", e);
            return fallback(IdentityResult.normalize(e));
        }

        try {
            return ProxyResponse.builder()
                    .statusCode(result.getStatusCode())
                    .headers(JSON_HEADERS)
                    .body(MAPPER.writeValueAsString(result.getBody()))
                    .build();
        } catch (Exception e) {
            log.error("Failed to serialize diagnostic response", e);
            return fallback(IdentityResult.normalize(e));
        }
    }

    private ProxyResponse fallback(String error) {
        String body = MAPPER.createObjectNode()
                .put("message", DiagnosticReporter.FAILURE_MESSAGE)
                .put("error", error)
                .toString();
        return ProxyResponse.builder()
                .statusCode(500)
                .headers(JSON_HEADERS)
                .body(body)
                .build();
    }
}
