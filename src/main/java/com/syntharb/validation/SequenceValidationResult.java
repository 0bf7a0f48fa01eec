package com.syntharb.validation;

import java.util.List;
import lombok.Getter;

@Getter
public class SequenceValidationResult {

    private final List<SequenceIssue> issues;
    private final int totalTicks;

    public SequenceValidationResult(List<SequenceIssue> issues, int totalTicks) {
        this.issues = List.copyOf(issues);
        this.totalTicks = totalTicks;
    }

    public boolean isValid() {
        return issues.isEmpty();
    }

    public long count(SequenceIssue.Type type) {
        return issues.stream().filter(issue -> issue.getType() == type).count();
    }
}
