package ca.gc.cra.burndler.application.template;

/**
 * Base class for template rendering failures. The subclass tells which phase failed: parsing, execution, or
 * validation of the rendered structure.
 *
 * @since 0.1.0
 */
public abstract class TemplateException extends Exception {
  private static final long serialVersionUID = 1L;

  protected TemplateException(String message) {
    super(message);
  }

  protected TemplateException(String message, Throwable cause) {
    super(message, cause);
  }
}
