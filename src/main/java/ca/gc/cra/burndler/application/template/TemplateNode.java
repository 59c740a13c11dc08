package ca.gc.cra.burndler.application.template;

import java.util.List;

/**
 * Parsed template tree. Produced by {@link TemplateParser} and walked by {@link TemplateExecutor}.
 *
 * @since 0.1.0
 */
interface TemplateNode {

  /** Literal text copied to the output. */
  record Text(String text) implements TemplateNode {}

  /** {@code {{ pipeline }}}: evaluates and prints the pipeline. */
  record Action(Pipeline pipeline, int line) implements TemplateNode {}

  /** {@code if} / {@code else if} chain with an optional {@code else}. */
  record If(List<Branch> branches, List<TemplateNode> otherwise) implements TemplateNode {}

  /** {@code range}: runs the body once per element with dot set to the element. */
  record Range(Pipeline pipeline, List<TemplateNode> body, List<TemplateNode> otherwise, int line)
      implements TemplateNode {}

  /** {@code with}: runs the body with dot set to the value when it is truthy. */
  record With(Pipeline pipeline, List<TemplateNode> body, List<TemplateNode> otherwise) implements TemplateNode {}

  /** One guarded body of an {@link If}. */
  record Branch(Pipeline condition, List<TemplateNode> body) {}

  /** Commands joined by {@code |}; each command after the first receives the previous result as last argument. */
  record Pipeline(List<Command> commands, int line) {}

  /** A function call with arguments, or a single operand. */
  record Command(List<Operand> operands) {
    boolean isCall() {
      return operands.get(0) instanceof Function;
    }
  }

  /** Argument or head of a command. */
  interface Operand {}

  /** Field chain, relative to dot or to the root ({@code $}). An empty chain is dot or root itself. */
  record Field(boolean fromRoot, List<String> path) implements Operand {
    String display() {
      return (fromRoot ? "$" : "") + (path.isEmpty() ? (fromRoot ? "" : ".") : "." + String.join(".", path));
    }
  }

  /** String, number, boolean, or nil literal. */
  record Literal(Object value) implements Operand {}

  /** Function identifier. */
  record Function(String name) implements Operand {}

  /** Parenthesised pipeline. */
  record Nested(Pipeline pipeline) implements Operand {}
}
