package ca.gc.cra.burndler.application.template;

import java.util.List;

/**
 * Function callable from a template action.
 *
 * <p>Implementations signal bad arguments with {@link IllegalArgumentException}; the executor reports them as
 * execution errors naming the function.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TemplateFunction {
  /**
   * Invokes the function.
   *
   * @param args evaluated arguments; a piped value arrives as the last argument
   * @return result value; may be {@code null}
   */
  Object apply(List<Object> args);
}
