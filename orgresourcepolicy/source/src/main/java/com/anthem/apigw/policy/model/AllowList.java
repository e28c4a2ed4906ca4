package com.anthem.apigw.policy.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Organization identifiers allowed to invoke the protected API.
 * Duplicates collapse to their first occurrence; blank entries are rejected.
 */
public final class AllowList {

    public enum Source {
        FILE,
        INLINE,
        NONE
    }

    private static final AllowList EMPTY = new AllowList(Source.NONE, Set.of());

    private final Source source;
    private final Set<String> accounts;

    private AllowList(Source source, Set<String> accounts) {
        this.source = source;
        this.accounts = accounts;
    }

    public static AllowList empty() {
        return EMPTY;
    }

    public static AllowList of(Source source, Collection<String> accounts) {
        Set<String> copy = new LinkedHashSet<>();
        for (String account : accounts) {
            if (account == null || account.isBlank()) {
                throw new IllegalArgumentException("Allow-list entries must be non-empty strings");
            }
            copy.add(account);
        }
        return new AllowList(source, Collections.unmodifiableSet(copy));
    }

    public Source getSource() {
        return source;
    }

    public Set<String> getAccounts() {
        return accounts;
    }

    public List<String> asList() {
        return List.copyOf(accounts);
    }

    public boolean isEmpty() {
        return accounts.isEmpty();
    }

    public int size() {
        return accounts.size();
    }

    @Override
    public String toString() {
        return "AllowList{source=" + source + ", accounts=" + accounts + "}";
    }
}
