package com.anthem.apigw.policy.service;

import com.anthem.apigw.policy.model.AllowList;
import com.anthem.apigw.policy.model.PolicyDocument;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the organization allow-list resource policy for an API Gateway REST API.
 * An empty allow-list yields no policy, which leaves the API unrestricted by organization.
 */
public class ResourcePolicyBuilder {

    public static final String STATEMENT_ID = "AllowAccessForAllowedAccounts";
    public static final String EFFECT_ALLOW = "Allow";
    public static final String ANY_PRINCIPAL = "*";
    public static final String INVOKE_ACTION = "execute-api:Invoke";
    public static final String ANY_RESOURCE = "*";
    public static final String CONDITION_OPERATOR = "ForAnyValue:StringEquals";
    public static final String ORG_ID_KEY = "aws:PrincipalOrgID";

    public Optional<PolicyDocument> buildPolicy(AllowList allowList) {
        return buildPolicy(allowList, ANY_RESOURCE);
    }

    /**
     * @param allowList    organization ids allowed to invoke the API
     * @param resourceArn  execute-api ARN to scope the statement to, or blank for any resource
     * @return the policy, or empty when the allow-list is empty
     */
    public Optional<PolicyDocument> buildPolicy(AllowList allowList, String resourceArn) {
        if (allowList == null || allowList.isEmpty()) {
            return Optional.empty();
        }

        PolicyDocument.Statement statement = PolicyDocument.Statement.builder()
                .sid(STATEMENT_ID)
                .effect(EFFECT_ALLOW)
                .principal(ANY_PRINCIPAL)
                .action(INVOKE_ACTION)
                .resource(resourceArn == null || resourceArn.isBlank() ? ANY_RESOURCE : resourceArn)
                .condition(Map.of(CONDITION_OPERATOR, Map.of(ORG_ID_KEY, allowList.asList())))
                .build();

        return Optional.of(PolicyDocument.builder()
                .version(PolicyDocument.VERSION)
                .statement(List.of(statement))
                .build());
    }
}
