package com.anthem.apigw.policy.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Where the allow-list comes from. Both values are optional; the file wins
 * when both are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AllowListSettings {

    public static final String FILE_VARIABLE = "ALLOWED_ACCOUNTS_FILE";
    public static final String INLINE_VARIABLE = "ALLOWED_ACCOUNTS";

    /**
     * Path to a JSON file holding an array of organization ids.
     */
    private String file;

    /**
     * Comma-separated organization ids.
     */
    private String inline;

    public static AllowListSettings fromEnvironment(Map<String, String> env) {
        return AllowListSettings.builder()
                .file(env.get(FILE_VARIABLE))
                .inline(env.get(INLINE_VARIABLE))
                .build();
    }

    public boolean hasFile() {
        return file != null && !file.isEmpty();
    }

    public boolean hasInline() {
        return inline != null && !inline.isEmpty();
    }
}
