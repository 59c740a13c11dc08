package ca.gc.cra.burndler.domain.compose;

import java.util.Objects;

/**
 * A single lint finding.
 *
 * @param rule rule that produced the finding
 * @param severity error or warning
 * @param message human readable description
 * @param line 1-based line in the linted text, or {@code 0} when the finding is not line based
 * @since 0.1.0
 */
public record LintIssue(LintRule rule, LintSeverity severity, String message, int line) {
  public LintIssue {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
  }

  public static LintIssue error(LintRule rule, String message) {
    return new LintIssue(rule, LintSeverity.ERROR, message, 0);
  }

  public static LintIssue warning(LintRule rule, String message) {
    return new LintIssue(rule, LintSeverity.WARNING, message, 0);
  }

  @Override
  public String toString() {
    String location = line > 0 ? " (line " + line + ")" : "";
    return "[" + rule.id() + "] " + message + location;
  }
}
