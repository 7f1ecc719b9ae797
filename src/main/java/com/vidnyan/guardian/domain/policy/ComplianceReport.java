package com.vidnyan.guardian.domain.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record ComplianceReport(
    @JsonProperty("status") Verdict status,
    @JsonProperty("violations") List<PolicyViolation> violations
) {

    public ComplianceReport {
        violations = List.copyOf(violations);
    }

    public static ComplianceReport passed() {
        return new ComplianceReport(Verdict.PASS, List.of());
    }

    public static ComplianceReport of(List<PolicyViolation> violations) {
        return new ComplianceReport(violations.isEmpty() ? Verdict.PASS : Verdict.FAIL, violations);
    }

    @JsonIgnore
    public boolean isPassing() {
        return status == Verdict.PASS;
    }

    public enum Verdict {
        PASS,
        FAIL;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
