package com.layoutstudio.backend.api.dto;

import com.layoutstudio.backend.domain.Severity;
import com.layoutstudio.backend.domain.ValidationIssue;

import java.util.List;

public record ValidationReport(boolean valid, long errorCount, long warningCount, List<ValidationIssue> issues) {
    public static ValidationReport of(List<ValidationIssue> issues) {
        long errors = issues.stream().filter(i -> i.severity() == Severity.ERROR).count();
        return new ValidationReport(errors == 0, errors, issues.size() - errors, issues);
    }
}
