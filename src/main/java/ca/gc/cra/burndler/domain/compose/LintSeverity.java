package ca.gc.cra.burndler.domain.compose;

/** Whether a lint finding invalidates the document. */
public enum LintSeverity {
  ERROR,
  WARNING
}
