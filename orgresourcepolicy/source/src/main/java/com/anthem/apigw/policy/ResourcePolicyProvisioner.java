package com.anthem.apigw.policy;

import com.anthem.apigw.policy.model.AllowList;
import com.anthem.apigw.policy.model.AllowListSettings;
import com.anthem.apigw.policy.model.PolicyDocument;
import com.anthem.apigw.policy.service.AllowListLoader;
import com.anthem.apigw.policy.service.PolicyJson;
import com.anthem.apigw.policy.service.ResourcePolicyBuilder;
import com.anthem.apigw.policy.service.RestApiPolicyAttacher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Provisioning entry point for the organization allow-list resource policy.
 *
 * Reads the allow-list from ALLOWED_ACCOUNTS_FILE or ALLOWED_ACCOUNTS, builds the
 * policy and either attaches it to REST_API_ID or prints it for the surrounding
 * provisioning tool. A bad allow-list source aborts with a non-zero exit code so
 * that the API is never deployed without its restriction.
 *
 * Exit codes:
 * - 0: policy attached, printed, or not needed
 * - 1: allow-list configuration error
 * - 2: API Gateway rejected the update
 */
public class ResourcePolicyProvisioner {

    private static final Logger log = LoggerFactory.getLogger(ResourcePolicyProvisioner.class);

    static final String REST_API_ID_VARIABLE = "REST_API_ID";
    static final String RESOURCE_ARN_VARIABLE = "POLICY_RESOURCE_ARN";
    static final String REGION_VARIABLE = "AWS_REGION";

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION_ERROR = 1;
    static final int EXIT_ATTACH_ERROR = 2;

    private final AllowListLoader allowListLoader;
    private final ResourcePolicyBuilder policyBuilder;
    private final PolicyJson policyJson;
    private final Function<String, RestApiPolicyAttacher> attacherFactory;
    private final PrintStream out;

    public ResourcePolicyProvisioner() {
        this(new AllowListLoader(), new ResourcePolicyBuilder(), new PolicyJson(),
                RestApiPolicyAttacher::new, System.out);
    }

    // For testing
    public ResourcePolicyProvisioner(AllowListLoader allowListLoader,
                                     ResourcePolicyBuilder policyBuilder,
                                     PolicyJson policyJson,
                                     Function<String, RestApiPolicyAttacher> attacherFactory,
                                     PrintStream out) {
        this.allowListLoader = allowListLoader;
        this.policyBuilder = policyBuilder;
        this.policyJson = policyJson;
        this.attacherFactory = attacherFactory;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new ResourcePolicyProvisioner().run(System.getenv());
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    public int run(Map<String, String> env) {
        AllowList allowList;
        try {
            allowList = allowListLoader.load(AllowListSettings.fromEnvironment(env));
        } catch (ConfigurationException e) {
            log.error("Invalid allow-list configuration, aborting provisioning: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION_ERROR;
        }

        Optional<PolicyDocument> policy = policyBuilder.buildPolicy(allowList, env.get(RESOURCE_ARN_VARIABLE));
        if (policy.isEmpty()) {
            log.info("Allow-list is empty, no resource policy attached");
            return EXIT_OK;
        }

        String restApiId = env.get(REST_API_ID_VARIABLE);
        if (restApiId == null || restApiId.isBlank()) {
            String json = policyJson.write(policy.get());
            log.info("No {} set, resource policy \"{}\" written to stdout", REST_API_ID_VARIABLE, json);
            out.println(json);
            return EXIT_OK;
        }

        try {
            RestApiPolicyAttacher attacher = attacherFactory.apply(env.getOrDefault(REGION_VARIABLE, "us-east-1"));
            attacher.attach(restApiId, policy.get());
            return EXIT_OK;
        } catch (PolicyAttachException e) {
            log.error("Provisioning failed: {}", e.getMessage());
            return EXIT_ATTACH_ERROR;
        }
    }
}
