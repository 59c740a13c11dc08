package ca.gc.cra.burndler.application.template;

/** The template text is malformed or calls an unknown function. */
public final class TemplateParseException extends TemplateException {
  private static final long serialVersionUID = 1L;

  public TemplateParseException(String detail) {
    super("template parse error: " + detail);
  }
}
