package com.sni.curation.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record IntegrityReport(
        OffsetDateTime checkedAt,
        String overallStatus,
        List<IntegrityCheck> checks
) {
    /**
     * Builds a report whose overall status is the worst status among its checks.
     */
    public static IntegrityReport of(OffsetDateTime checkedAt, List<IntegrityCheck> checks) {
        String overall = IntegrityCheck.PASS;
        for (IntegrityCheck check : checks) {
            if (IntegrityCheck.FAIL.equals(check.status())) {
                overall = IntegrityCheck.FAIL;
                break;
            }
            if (IntegrityCheck.WARNING.equals(check.status())) {
                overall = IntegrityCheck.WARNING;
            }
        }
        return new IntegrityReport(checkedAt, overall, List.copyOf(checks));
    }

    public IntegrityCheck check(String checkName) {
        return checks.stream()
                .filter(c -> c.checkName().equals(checkName))
                .findFirst()
                .orElse(null);
    }
}
