package com.anthem.apigw.policy.service;

import com.anthem.apigw.policy.ConfigurationException;
import com.anthem.apigw.policy.model.AllowList;
import com.anthem.apigw.policy.model.AllowListSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Resolves the allow-list from either a JSON file or an inline comma-separated value.
 *
 * Precedence:
 * - ALLOWED_ACCOUNTS_FILE: JSON array of strings, any problem aborts provisioning
 * - ALLOWED_ACCOUNTS: split on commas, trimmed; a value with no ids aborts provisioning
 * - neither: empty allow-list (no organization restriction)
 */
public class AllowListLoader {

    private static final Logger log = LoggerFactory.getLogger(AllowListLoader.class);

    private final ObjectMapper objectMapper;

    public AllowListLoader() {
        this(new ObjectMapper());
    }

    public AllowListLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AllowList load(AllowListSettings settings) {
        if (settings.hasFile()) {
            if (settings.hasInline()) {
                log.warn("Both {} and {} are set, using file: {}",
                        AllowListSettings.FILE_VARIABLE, AllowListSettings.INLINE_VARIABLE, settings.getFile());
            }
            return fromFile(Path.of(settings.getFile()));
        } else if (settings.hasInline()) {
            return fromInline(settings.getInline());
        } else {
            log.info("No allow-list configured, organization restriction disabled");
            return AllowList.empty();
        }
    }

    AllowList fromFile(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Error reading " + AllowListSettings.FILE_VARIABLE + ": " + file, e);
        }

        JsonNode root;
        try {
            root = objectMapper.readerFor(JsonNode.class)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(content);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Error parsing " + AllowListSettings.FILE_VARIABLE + ": " + file, e);
        }

        if (root == null || !root.isArray()) {
            throw new ConfigurationException(
                    "The " + AllowListSettings.FILE_VARIABLE + " must contain a JSON array of account IDs.");
        }

        List<String> accounts = new ArrayList<>();
        for (JsonNode element : root) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new ConfigurationException(
                        "The " + AllowListSettings.FILE_VARIABLE + " contains an invalid entry: " + element);
            }
            accounts.add(element.asText());
        }

        AllowList allowList = AllowList.of(AllowList.Source.FILE, accounts);
        log.info("Loaded allow-list from file: path={}, entries={}", file, allowList.size());
        return allowList;
    }

    AllowList fromInline(String inline) {
        List<String> accounts = Arrays.stream(inline.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (accounts.isEmpty()) {
            throw new ConfigurationException(
                    "The " + AllowListSettings.INLINE_VARIABLE + " is set but contains no account IDs: \"" + inline + "\"");
        }

        AllowList allowList = AllowList.of(AllowList.Source.INLINE, accounts);
        log.info("Loaded allow-list from {}: entries={}", AllowListSettings.INLINE_VARIABLE, allowList.size());
        return allowList;
    }
}
