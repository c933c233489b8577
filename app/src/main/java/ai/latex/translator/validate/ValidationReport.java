package ai.latex.translator.validate;

import java.util.List;

/**
 * All issues of one validation pass. A project is compilable when no issue is an error.
 */
public record ValidationReport(List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean compilable() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public long errorCount() {
        return count(Severity.ERROR);
    }

    public long warningCount() {
        return count(Severity.WARNING);
    }

    public List<ValidationIssue> issuesFor(String filePath) {
        return issues.stream().filter(issue -> issue.filePath().equals(filePath)).toList();
    }

    public List<ValidationIssue> issuesOf(IssueKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }

    private long count(Severity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
