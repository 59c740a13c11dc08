package ca.gc.cra.burndler.domain.build;

/** Whether a configuration file is rendered or copied verbatim. */
public enum FileKind {
  TEMPLATE,
  STATIC
}
