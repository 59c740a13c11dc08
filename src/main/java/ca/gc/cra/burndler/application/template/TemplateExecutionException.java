package ca.gc.cra.burndler.application.template;

/** The template parsed but failed while running: bad function arguments, field access through null, and so on. */
public final class TemplateExecutionException extends TemplateException {
  private static final long serialVersionUID = 1L;

  public TemplateExecutionException(String detail) {
    super("template execution error: " + detail);
  }

  public TemplateExecutionException(String detail, Throwable cause) {
    super("template execution error: " + detail, cause);
  }
}
