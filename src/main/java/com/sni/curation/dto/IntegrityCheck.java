package com.sni.curation.dto;

import java.util.List;
import java.util.UUID;

/**
 * Result of one integrity check. {@code status} is PASS, WARNING or FAIL.
 */
public record IntegrityCheck(
        String checkName,
        String status,
        String details,
        long affectedCount,
        List<UUID> offendingIds
) {
    public static final String PASS = "PASS";
    public static final String WARNING = "WARNING";
    public static final String FAIL = "FAIL";

    public static IntegrityCheck of(String checkName, String details, String failureLevel, List<UUID> offendingIds) {
        List<UUID> ids = offendingIds == null ? List.of() : List.copyOf(offendingIds);
        return new IntegrityCheck(checkName, ids.isEmpty() ? PASS : failureLevel, details, ids.size(), ids);
    }

    public boolean passed() {
        return PASS.equals(status);
    }
}
