package ca.gc.cra.burndler.application.template;

/** Rendered output is not valid YAML or JSON. */
public final class TemplateStructureException extends TemplateException {
  private static final long serialVersionUID = 1L;

  public TemplateStructureException(TemplateFormat format, String detail, Throwable cause) {
    super("invalid " + format.displayName() + " after rendering: " + detail, cause);
  }
}
