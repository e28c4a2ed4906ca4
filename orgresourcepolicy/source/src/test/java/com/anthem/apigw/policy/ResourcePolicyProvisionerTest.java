package com.anthem.apigw.policy;

import com.anthem.apigw.policy.model.PolicyDocument;
import com.anthem.apigw.policy.service.AllowListLoader;
import com.anthem.apigw.policy.service.PolicyJson;
import com.anthem.apigw.policy.service.ResourcePolicyBuilder;
import com.anthem.apigw.policy.service.RestApiPolicyAttacher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ResourcePolicyProvisioner.
 */
@ExtendWith(MockitoExtension.class)
class ResourcePolicyProvisionerTest {

    @TempDir
    Path tempDir;

    @Mock
    private RestApiPolicyAttacher attacher;

    private final List<String> requestedRegions = new ArrayList<>();
    private ByteArrayOutputStream stdout;
    private PolicyJson policyJson;
    private ResourcePolicyProvisioner provisioner;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        policyJson = new PolicyJson();
        provisioner = new ResourcePolicyProvisioner(
                new AllowListLoader(),
                new ResourcePolicyBuilder(),
                policyJson,
                region -> {
                    requestedRegions.add(region);
                    return attacher;
                },
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    void run_noAllowList_attachesNothing() {
        int exitCode = provisioner.run(Map.of("REST_API_ID", "a1b2c3"));

        assertThat(exitCode).isZero();
        assertThat(requestedRegions).isEmpty();
        verifyNoInteractions(attacher);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void run_inlineAllowListWithRestApi_attachesPolicy() {
        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS", "o-abc123, o-def456",
                "REST_API_ID", "a1b2c3",
                "AWS_REGION", "us-east-2"));

        assertThat(exitCode).isZero();
        assertThat(requestedRegions).containsExactly("us-east-2");

        ArgumentCaptor<PolicyDocument> captor = ArgumentCaptor.forClass(PolicyDocument.class);
        verify(attacher).attach(eq("a1b2c3"), captor.capture());
        assertThat(captor.getValue().getStatement().get(0).getCondition()
                .get("ForAnyValue:StringEquals").get("aws:PrincipalOrgID"))
                .containsExactlyInAnyOrder("o-abc123", "o-def456");
    }

    @Test
    void run_withoutRestApi_printsPolicy() throws Exception {
        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS", "o-abc123",
                "POLICY_RESOURCE_ARN", "arn:aws:execute-api:us-east-1:123456789012:a1b2c3/*"));

        assertThat(exitCode).isZero();
        verifyNoInteractions(attacher);

        PolicyDocument printed = policyJson.read(stdout.toString(StandardCharsets.UTF_8).trim());
        assertThat(printed.getStatement().get(0).getResource())
                .isEqualTo("arn:aws:execute-api:us-east-1:123456789012:a1b2c3/*");
    }

    @Test
    void run_malformedFile_abortsWithoutPolicy() throws Exception {
        Path file = tempDir.resolve("accounts.json");
        Files.writeString(file, "{\"not\": \"an array\"}", StandardCharsets.UTF_8);

        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS_FILE", file.toString(),
                "ALLOWED_ACCOUNTS", "o-abc123",
                "REST_API_ID", "a1b2c3"));

        assertThat(exitCode).isEqualTo(1);
        verifyNoInteractions(attacher);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void run_inlineWithoutIds_abortsWithoutCreatingAttacher() {
        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS", " , ",
                "REST_API_ID", "a1b2c3"));

        assertThat(exitCode).isEqualTo(1);
        assertThat(requestedRegions).isEmpty();
        verifyNoInteractions(attacher);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void run_fileAndInline_fileDeterminesPolicy() throws Exception {
        Path file = tempDir.resolve("accounts.json");
        Files.writeString(file, "[\"o-fromfile\"]", StandardCharsets.UTF_8);

        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS_FILE", file.toString(),
                "ALLOWED_ACCOUNTS", "o-inline"));

        assertThat(exitCode).isZero();
        PolicyDocument printed = policyJson.read(stdout.toString(StandardCharsets.UTF_8).trim());
        assertThat(printed.getStatement().get(0).getCondition()
                .get("ForAnyValue:StringEquals").get("aws:PrincipalOrgID"))
                .containsExactly("o-fromfile");
    }

    @Test
    void run_attachFailure_returnsAttachErrorCode() {
        doThrow(new PolicyAttachException("Failed to attach resource policy to API a1b2c3",
                new RuntimeException("AccessDenied")))
                .when(attacher).attach(eq("a1b2c3"), any(PolicyDocument.class));

        int exitCode = provisioner.run(Map.of(
                "ALLOWED_ACCOUNTS", "o-abc123",
                "REST_API_ID", "a1b2c3"));

        assertThat(exitCode).isEqualTo(2);
        assertThat(requestedRegions).containsExactly("us-east-1");
    }
}
