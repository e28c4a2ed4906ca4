package com.anthem.apigw.debug.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

/**
 * HTTP status and JSON body of a diagnostic response.
 */
@Data
@AllArgsConstructor
public class DiagnosticResult {

    private int statusCode;

    private Map<String, Object> body;
}
