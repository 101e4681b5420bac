package com.pwdaudit.domain.audit.model;

/**
 * Flag severity. Declaration order is the escalation order, so {@code compareTo} picks the worst.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
