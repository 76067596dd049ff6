package com.workflow.admission.ratelimit.core;

import java.util.Locale;

/** Identity lists consulted before any counting. */
public enum AccessList {
    /** Always admitted, never counted. */
    WHITELIST,
    /** Always rejected until the entry expires or is removed. */
    BLACKLIST;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccessList fromId(String id) {
        for (AccessList l : values()) {
            if (l.id().equalsIgnoreCase(id)) return l;
        }
        throw new IllegalArgumentException("unknown access list: " + id);
    }
}
