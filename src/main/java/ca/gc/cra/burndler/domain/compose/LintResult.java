package ca.gc.cra.burndler.domain.compose;

import java.util.List;

/**
 * Lint outcome; valid exactly when there are no errors.
 *
 * @param errors error findings
 * @param warnings warning findings
 * @since 0.1.0
 */
public record LintResult(List<LintIssue> errors, List<LintIssue> warnings) {
  public LintResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean valid() {
    return errors.isEmpty();
  }
}
