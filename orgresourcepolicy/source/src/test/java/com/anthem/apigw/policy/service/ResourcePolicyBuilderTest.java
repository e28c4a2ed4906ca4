package com.anthem.apigw.policy.service;

import com.anthem.apigw.policy.model.AllowList;
import com.anthem.apigw.policy.model.PolicyDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResourcePolicyBuilder.
 */
class ResourcePolicyBuilderTest {

    private ResourcePolicyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new ResourcePolicyBuilder();
    }

    @Test
    void buildPolicy_emptyAllowList_returnsEmpty() {
        assertTrue(builder.buildPolicy(AllowList.empty()).isEmpty());
        assertTrue(builder.buildPolicy(AllowList.of(AllowList.Source.INLINE, List.of())).isEmpty());
    }

    @Test
    void buildPolicy_nullAllowList_returnsEmpty() {
        assertTrue(builder.buildPolicy(null).isEmpty());
    }

    @Test
    void buildPolicy_singleAccount_buildsAllowStatement() {
        AllowList allowList = AllowList.of(AllowList.Source.INLINE, List.of("o-abc123"));

        Optional<PolicyDocument> result = builder.buildPolicy(allowList);

        assertTrue(result.isPresent());
        PolicyDocument policy = result.get();
        assertEquals("2012-10-17", policy.getVersion());
        assertEquals(1, policy.getStatement().size());

        PolicyDocument.Statement statement = policy.getStatement().get(0);
        assertEquals("AllowAccessForAllowedAccounts", statement.getSid());
        assertEquals("Allow", statement.getEffect());
        assertEquals("*", statement.getPrincipal());
        assertEquals("execute-api:Invoke", statement.getAction());
        assertEquals("*", statement.getResource());
        assertEquals(Map.of("ForAnyValue:StringEquals", Map.of("aws:PrincipalOrgID", List.of("o-abc123"))),
                statement.getCondition());
    }

    @Test
    void buildPolicy_manyAccounts_conditionMatchesAllowListAsSet() {
        AllowList allowList = AllowList.of(AllowList.Source.FILE,
                List.of("o-333", "o-111", "o-222", "o-111"));

        PolicyDocument policy = builder.buildPolicy(allowList).orElseThrow();

        assertThat(policy.getStatement()).hasSize(1);
        List<String> orgIds = policy.getStatement().get(0).getCondition()
                .get(ResourcePolicyBuilder.CONDITION_OPERATOR)
                .get(ResourcePolicyBuilder.ORG_ID_KEY);
        assertThat(orgIds).containsExactlyInAnyOrder("o-111", "o-222", "o-333");
    }

    @Test
    void buildPolicy_withResourceArn_scopesResource() {
        AllowList allowList = AllowList.of(AllowList.Source.INLINE, List.of("o-abc123"));
        String arn = "arn:aws:execute-api:us-east-1:123456789012:a1b2c3/*";

        PolicyDocument policy = builder.buildPolicy(allowList, arn).orElseThrow();

        assertEquals(arn, policy.getStatement().get(0).getResource());
    }

    @Test
    void buildPolicy_withBlankResourceArn_usesWildcard() {
        AllowList allowList = AllowList.of(AllowList.Source.INLINE, List.of("o-abc123"));

        PolicyDocument policy = builder.buildPolicy(allowList, "  ").orElseThrow();

        assertEquals("*", policy.getStatement().get(0).getResource());
    }
}
