package ca.gc.cra.burndler.application.template;

import ca.gc.cra.burndler.application.template.TemplateNode.Command;
import ca.gc.cra.burndler.application.template.TemplateNode.Field;
import ca.gc.cra.burndler.application.template.TemplateNode.Literal;
import ca.gc.cra.burndler.application.template.TemplateNode.Nested;
import ca.gc.cra.burndler.application.template.TemplateNode.Operand;
import ca.gc.cra.burndler.application.template.TemplateNode.Pipeline;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Walks a parsed template against a variable tree and produces text.
 *
 * <p>Selecting a key the map does not contain is an execution error. A key present with a {@code null} value
 * prints as the empty string; selecting a field of {@code null} or of a non-map value is an execution error.
 *
 * @since 0.1.0
 */
final class TemplateExecutor {
  private final TemplateFunctions functions;

  TemplateExecutor(TemplateFunctions functions) {
    this.functions = Objects.requireNonNull(functions, "functions");
  }

  /**
   * Executes a parsed template.
   *
   * @param nodes parsed template
   * @param root variables; both the initial dot and {@code $}
   * @return rendered text
   * @throws TemplateExecutionException when evaluation fails
   */
  String execute(List<TemplateNode> nodes, Object root) throws TemplateExecutionException {
    StringBuilder out = new StringBuilder();
    walk(nodes, root, root, out);
    return out.toString();
  }

  private void walk(List<TemplateNode> nodes, Object dot, Object root, StringBuilder out)
      throws TemplateExecutionException {
    for (TemplateNode node : nodes) {
      if (node instanceof TemplateNode.Text text) {
        out.append(text.text());
      } else if (node instanceof TemplateNode.Action action) {
        out.append(TemplateValues.print(eval(action.pipeline(), dot, root)));
      } else if (node instanceof TemplateNode.If branchNode) {
        walkIf(branchNode, dot, root, out);
      } else if (node instanceof TemplateNode.Range range) {
        walkRange(range, dot, root, out);
      } else if (node instanceof TemplateNode.With with) {
        Object value = eval(with.pipeline(), dot, root);
        if (TemplateValues.truthy(value)) {
          walk(with.body(), value, root, out);
        } else {
          walk(with.otherwise(), dot, root, out);
        }
      } else {
        throw new IllegalStateException("Unknown template node " + node);
      }
    }
  }

  private void walkIf(TemplateNode.If node, Object dot, Object root, StringBuilder out)
      throws TemplateExecutionException {
    for (TemplateNode.Branch branch : node.branches()) {
      if (TemplateValues.truthy(eval(branch.condition(), dot, root))) {
        walk(branch.body(), dot, root, out);
        return;
      }
    }
    walk(node.otherwise(), dot, root, out);
  }

  private void walkRange(TemplateNode.Range range, Object dot, Object root, StringBuilder out)
      throws TemplateExecutionException {
    Object value = eval(range.pipeline(), dot, root);
    Collection<?> items;
    if (value == null) {
      items = List.of();
    } else if (value instanceof Collection<?> collection) {
      items = collection;
    } else if (value instanceof Map<?, ?> map) {
      TreeMap<String, Object> sorted = new TreeMap<>();
      map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
      items = sorted.values();
    } else {
      throw new TemplateExecutionException(
          "line " + range.line() + ": range can't iterate over " + TemplateValues.print(value));
    }
    if (items.isEmpty()) {
      walk(range.otherwise(), dot, root, out);
      return;
    }
    for (Object item : items) {
      walk(range.body(), item, root, out);
    }
  }

  private Object eval(Pipeline pipeline, Object dot, Object root) throws TemplateExecutionException {
    Object value = null;
    boolean piped = false;
    for (Command command : pipeline.commands()) {
      value = evalCommand(command, dot, root, piped, value, pipeline.line());
      piped = true;
    }
    return value;
  }

  private Object evalCommand(Command command, Object dot, Object root, boolean piped, Object input, int line)
      throws TemplateExecutionException {
    List<Operand> operands = command.operands();
    if (!command.isCall()) {
      return evalOperand(operands.get(0), dot, root, line);
    }
    String name = ((TemplateNode.Function) operands.get(0)).name();
    List<Object> args = new ArrayList<>(operands.size());
    for (int i = 1; i < operands.size(); i++) {
      args.add(evalOperand(operands.get(i), dot, root, line));
    }
    if (piped) {
      args.add(input);
    }
    return call(name, args, line);
  }

  private Object evalOperand(Operand operand, Object dot, Object root, int line) throws TemplateExecutionException {
    if (operand instanceof Field field) {
      return resolve(field, dot, root, line);
    }
    if (operand instanceof Literal literal) {
      return literal.value();
    }
    if (operand instanceof Nested nested) {
      return eval(nested.pipeline(), dot, root);
    }
    if (operand instanceof TemplateNode.Function function) {
      return call(function.name(), new ArrayList<>(), line);
    }
    throw new IllegalStateException("Unknown operand " + operand);
  }

  private static Object resolve(Field field, Object dot, Object root, int line) throws TemplateExecutionException {
    Object current = field.fromRoot() ? root : dot;
    StringBuilder walked = new StringBuilder(field.fromRoot() ? "$" : "");
    for (String name : field.path()) {
      walked.append('.').append(name);
      if (current instanceof Map<?, ?> map) {
        if (!map.containsKey(name)) {
          throw new TemplateExecutionException("line " + line + ": map has no entry for key \"" + name + "\"");
        }
        current = map.get(name);
      } else if (current == null) {
        throw new TemplateExecutionException("line " + line + ": nil pointer evaluating " + walked);
      } else {
        throw new TemplateExecutionException("line " + line + ": can't evaluate field " + name + " in type "
            + TemplateValues.describe(current));
      }
    }
    return current;
  }

  private Object call(String name, List<Object> args, int line) throws TemplateExecutionException {
    TemplateFunction function = functions.find(name)
        .orElseThrow(() -> new IllegalStateException("function " + name + " passed parsing but is not registered"));
    try {
      return function.apply(args);
    } catch (IllegalArgumentException | ArithmeticException ex) {
      throw new TemplateExecutionException("line " + line + ": error calling " + name + ": " + ex.getMessage(), ex);
    }
  }
}
