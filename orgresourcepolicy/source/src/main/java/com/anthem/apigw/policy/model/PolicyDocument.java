package com.anthem.apigw.policy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * API Gateway resource policy (IAM policy document).
 * Field names follow the IAM JSON grammar so the serialized form can be
 * attached to a REST API as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Version", "Statement"})
public class PolicyDocument {

    public static final String VERSION = "2012-10-17";

    @Builder.Default
    @JsonProperty("Version")
    private String version = VERSION;

    @JsonProperty("Statement")
    private List<Statement> statement;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"Sid", "Effect", "Principal", "Action", "Resource", "Condition"})
    public static class Statement {

        @JsonProperty("Sid")
        private String sid;

        /**
         * Allow or Deny. Only Allow is produced here.
         */
        @JsonProperty("Effect")
        private String effect;

        @JsonProperty("Principal")
        private String principal;

        @JsonProperty("Action")
        private String action;

        @JsonProperty("Resource")
        private String resource;

        /**
         * Condition operator -> condition key -> accepted values,
         * e.g. ForAnyValue:StringEquals -> aws:PrincipalOrgID -> [o-abc123].
         */
        @JsonProperty("Condition")
        private Map<String, Map<String, List<String>>> condition;
    }
}
