package com.pwdaudit.infrastructure.audit.rule;

import com.pwdaudit.domain.audit.model.AuditThresholds;

import java.time.LocalDate;

/**
 * Everything a record rule may read besides the record itself. Built once per run.
 */
public record RuleContext(
        AuditThresholds thresholds,
        LocalDate asOf,
        ExecutionWorkIndex executionWorks
) {}
