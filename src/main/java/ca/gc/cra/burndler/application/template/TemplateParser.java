package ca.gc.cra.burndler.application.template;

import ca.gc.cra.burndler.application.template.TemplateNode.Branch;
import ca.gc.cra.burndler.application.template.TemplateNode.Command;
import ca.gc.cra.burndler.application.template.TemplateNode.Field;
import ca.gc.cra.burndler.application.template.TemplateNode.Literal;
import ca.gc.cra.burndler.application.template.TemplateNode.Nested;
import ca.gc.cra.burndler.application.template.TemplateNode.Operand;
import ca.gc.cra.burndler.application.template.TemplateNode.Pipeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses template text into a {@link TemplateNode} tree.
 *
 * <p>Actions support field chains ({@code .a.b}, {@code $.a.b}), string/number/boolean/nil literals, function
 * calls, pipelines ({@code x | f y}), parenthesised pipelines, {@code if}/{@code else if}/{@code else},
 * {@code range} and {@code with} (both with optional {@code else}), comments, and the trim markers
 * <code>&#123;&#123;- </code> and <code> -&#125;&#125;</code>.
 *
 * <p>Function names are resolved at parse time against the injected {@link TemplateFunctions}.
 *
 * @since 0.1.0
 */
final class TemplateParser {
  private static final Set<String> KEYWORDS = Set.of("if", "else", "end", "range", "with");
  private static final Set<String> BLOCK_END = Set.of("else", "end");
  private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  private final TemplateFunctions functions;

  TemplateParser(TemplateFunctions functions) {
    this.functions = Objects.requireNonNull(functions, "functions");
  }

  /**
   * Parses a template.
   *
   * @param source template text
   * @return top-level nodes
   * @throws TemplateParseException when the text is malformed
   */
  List<TemplateNode> parse(String source) throws TemplateParseException {
    Cursor cursor = new Cursor(split(source));
    Block block = parseList(cursor, Set.of());
    if (block.stop() != null) {
      throw error(block.stop().line(), "unexpected {{" + block.stop().keyword() + "}}");
    }
    return block.nodes();
  }

  private record Segment(boolean action, String text, int line) {}

  private static List<Segment> split(String source) throws TemplateParseException {
    List<Segment> segments = new ArrayList<>();
    int length = source.length();
    int pos = 0;
    int line = 1;
    while (pos < length) {
      int open = source.indexOf("{{", pos);
      if (open < 0) {
        segments.add(new Segment(false, source.substring(pos), line));
        break;
      }
      String text = source.substring(pos, open);
      int actionLine = line + newlines(text);
      int contentStart = open + 2;
      boolean trimLeft = contentStart + 1 < length
          && source.charAt(contentStart) == '-'
          && isSpace(source.charAt(contentStart + 1));
      if (trimLeft) {
        contentStart += 2;
        text = text.stripTrailing();
      }
      int close = findClose(source, contentStart, actionLine);
      int contentEnd = close;
      boolean trimRight = close - 2 >= contentStart
          && source.charAt(close - 1) == '-'
          && isSpace(source.charAt(close - 2));
      if (trimRight) {
        contentEnd = close - 1;
      }
      if (!text.isEmpty()) {
        segments.add(new Segment(false, text, line));
      }
      segments.add(new Segment(true, source.substring(contentStart, contentEnd).trim(), actionLine));
      int next = close + 2;
      if (trimRight) {
        while (next < length && isSpace(source.charAt(next))) {
          next++;
        }
      }
      line = actionLine + newlines(source.substring(open, next));
      pos = next;
    }
    return segments;
  }

  private static int findClose(String source, int from, int line) throws TemplateParseException {
    int length = source.length();
    int i = from;
    while (i < length && isSpace(source.charAt(i))) {
      i++;
    }
    if (source.startsWith("/*", i)) {
      int end = source.indexOf("*/", i + 2);
      if (end < 0) {
        throw error(line, "unclosed comment");
      }
      i = end + 2;
    }
    while (i < length) {
      char c = source.charAt(i);
      if (c == '"' || c == '`' || c == '\'') {
        int end = skipQuoted(source, i, line);
        i = end + 1;
        continue;
      }
      if (c == '}' && i + 1 < length && source.charAt(i + 1) == '}') {
        return i;
      }
      i++;
    }
    throw error(line, "unclosed action");
  }

  private static int skipQuoted(String source, int start, int line) throws TemplateParseException {
    char quote = source.charAt(start);
    for (int i = start + 1; i < source.length(); i++) {
      char c = source.charAt(i);
      if (c == '\\' && quote != '`') {
        i++;
        continue;
      }
      if (c == '\n' && quote != '`') {
        break;
      }
      if (c == quote) {
        return i;
      }
    }
    throw error(line, "unterminated quoted string");
  }

  private record Stop(String keyword, List<Token> rest, int line) {}

  private record Block(List<TemplateNode> nodes, Stop stop) {}

  private static final class Cursor {
    private final List<Segment> segments;
    private int index;

    Cursor(List<Segment> segments) {
      this.segments = segments;
    }

    boolean hasNext() {
      return index < segments.size();
    }

    Segment next() {
      return segments.get(index++);
    }
  }

  private Block parseList(Cursor cursor, Set<String> terminators) throws TemplateParseException {
    List<TemplateNode> nodes = new ArrayList<>();
    while (cursor.hasNext()) {
      Segment segment = cursor.next();
      if (!segment.action()) {
        nodes.add(new TemplateNode.Text(segment.text()));
        continue;
      }
      String content = segment.text();
      if (content.startsWith("/*")) {
        continue;
      }
      List<Token> tokens = tokenize(content, segment.line());
      if (tokens.isEmpty()) {
        throw error(segment.line(), "missing value for command");
      }
      Token head = tokens.get(0);
      List<Token> rest = tokens.subList(1, tokens.size());
      if (head.type() == TokenType.IDENT && KEYWORDS.contains(head.text())) {
        switch (head.text()) {
          case "if" -> nodes.add(parseIf(cursor, parsePipeline(rest, segment.line()), segment.line()));
          case "range" -> nodes.add(parseRange(cursor, parsePipeline(rest, segment.line()), segment.line()));
          case "with" -> nodes.add(parseWith(cursor, parsePipeline(rest, segment.line()), segment.line()));
          default -> {
            if (!terminators.contains(head.text())) {
              throw error(segment.line(), "unexpected {{" + head.text() + "}}");
            }
            return new Block(nodes, new Stop(head.text(), rest, segment.line()));
          }
        }
        continue;
      }
      nodes.add(new TemplateNode.Action(parsePipeline(tokens, segment.line()), segment.line()));
    }
    if (!terminators.isEmpty()) {
      throw error(-1, "unexpected EOF");
    }
    return new Block(nodes, null);
  }

  private TemplateNode parseIf(Cursor cursor, Pipeline condition, int line) throws TemplateParseException {
    List<Branch> branches = new ArrayList<>();
    Block block = parseList(cursor, BLOCK_END);
    branches.add(new Branch(condition, block.nodes()));
    while (true) {
      Stop stop = block.stop();
      if ("end".equals(stop.keyword())) {
        requireEmpty(stop);
        return new TemplateNode.If(branches, List.of());
      }
      List<Token> rest = stop.rest();
      if (!rest.isEmpty() && rest.get(0).type() == TokenType.IDENT && "if".equals(rest.get(0).text())) {
        Pipeline next = parsePipeline(rest.subList(1, rest.size()), stop.line());
        block = parseList(cursor, BLOCK_END);
        branches.add(new Branch(next, block.nodes()));
        continue;
      }
      requireEmpty(stop);
      return new TemplateNode.If(branches, parseElse(cursor, line, "if"));
    }
  }

  private TemplateNode parseRange(Cursor cursor, Pipeline pipeline, int line) throws TemplateParseException {
    Block body = parseList(cursor, BLOCK_END);
    requireEmpty(body.stop());
    if ("end".equals(body.stop().keyword())) {
      return new TemplateNode.Range(pipeline, body.nodes(), List.of(), line);
    }
    return new TemplateNode.Range(pipeline, body.nodes(), parseElse(cursor, line, "range"), line);
  }

  private TemplateNode parseWith(Cursor cursor, Pipeline pipeline, int line) throws TemplateParseException {
    Block body = parseList(cursor, BLOCK_END);
    requireEmpty(body.stop());
    if ("end".equals(body.stop().keyword())) {
      return new TemplateNode.With(pipeline, body.nodes(), List.of());
    }
    return new TemplateNode.With(pipeline, body.nodes(), parseElse(cursor, line, "with"));
  }

  private List<TemplateNode> parseElse(Cursor cursor, int line, String owner) throws TemplateParseException {
    Block otherwise = parseList(cursor, BLOCK_END);
    if (!"end".equals(otherwise.stop().keyword())) {
      throw error(otherwise.stop().line(), "expected end; found {{else}} in " + owner + " started at line " + line);
    }
    requireEmpty(otherwise.stop());
    return otherwise.nodes();
  }

  private static void requireEmpty(Stop stop) throws TemplateParseException {
    if (!stop.rest().isEmpty()) {
      throw error(stop.line(), "unexpected " + stop.rest().get(0).text() + " in {{" + stop.keyword() + "}}");
    }
  }

  private Pipeline parsePipeline(List<Token> tokens, int line) throws TemplateParseException {
    List<Command> commands = new ArrayList<>();
    List<Token> current = new ArrayList<>();
    int depth = 0;
    for (Token token : tokens) {
      if (token.type() == TokenType.LPAREN) {
        depth++;
      } else if (token.type() == TokenType.RPAREN) {
        depth--;
        if (depth < 0) {
          throw error(line, "unexpected right paren");
        }
      }
      if (token.type() == TokenType.PIPE && depth == 0) {
        commands.add(parseCommand(current, line));
        current = new ArrayList<>();
      } else {
        current.add(token);
      }
    }
    if (depth != 0) {
      throw error(line, "unclosed left paren");
    }
    commands.add(parseCommand(current, line));
    for (int i = 1; i < commands.size(); i++) {
      if (!commands.get(i).isCall()) {
        throw error(line, "non executable command in pipeline stage " + (i + 1));
      }
    }
    return new Pipeline(commands, line);
  }

  private Command parseCommand(List<Token> tokens, int line) throws TemplateParseException {
    if (tokens.isEmpty()) {
      throw error(line, "missing value for command");
    }
    List<Operand> operands = new ArrayList<>();
    int i = 0;
    while (i < tokens.size()) {
      Token token = tokens.get(i);
      if (token.type() == TokenType.LPAREN) {
        int close = matchingParen(tokens, i);
        operands.add(new Nested(parsePipeline(tokens.subList(i + 1, close), line)));
        i = close + 1;
        continue;
      }
      operands.add(operand(token, line));
      i++;
    }
    if (operands.size() > 1 && !(operands.get(0) instanceof TemplateNode.Function)) {
      throw error(line, "can't give argument to non-function " + describe(operands.get(0)));
    }
    return new Command(operands);
  }

  private static int matchingParen(List<Token> tokens, int open) {
    int depth = 0;
    for (int i = open; i < tokens.size(); i++) {
      TokenType type = tokens.get(i).type();
      if (type == TokenType.LPAREN) {
        depth++;
      } else if (type == TokenType.RPAREN) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    throw new IllegalStateException("parenthesis balance already verified");
  }

  private Operand operand(Token token, int line) throws TemplateParseException {
    return switch (token.type()) {
      case FIELD -> new Field(false, path(token.text()));
      case ROOT -> new Field(true, path(token.text().substring(1)));
      case STRING -> new Literal(token.text());
      case NUMBER -> new Literal(number(token.text(), line));
      case IDENT -> identifier(token.text(), line);
      default -> throw error(line, "unexpected " + token.text() + " in operand");
    };
  }

  private Operand identifier(String name, int line) throws TemplateParseException {
    if ("true".equals(name) || "false".equals(name)) {
      return new Literal(Boolean.valueOf(name));
    }
    if ("nil".equals(name)) {
      return new Literal(null);
    }
    if (KEYWORDS.contains(name)) {
      throw error(line, "unexpected keyword " + name);
    }
    if (!functions.contains(name)) {
      throw error(line, "function \"" + name + "\" not defined");
    }
    return new TemplateNode.Function(name);
  }

  private static List<String> path(String chain) {
    if (chain.isEmpty() || ".".equals(chain)) {
      return List.of();
    }
    return List.of(chain.substring(1).split("\\."));
  }

  private static Object number(String text, int line) throws TemplateParseException {
    try {
      if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
        return Double.parseDouble(text);
      }
      return Long.parseLong(text.startsWith("+") ? text.substring(1) : text);
    } catch (NumberFormatException ex) {
      throw error(line, "bad number syntax: " + text);
    }
  }

  private static String describe(Operand operand) {
    if (operand instanceof Field field) {
      return field.display();
    }
    if (operand instanceof Literal literal) {
      return String.valueOf(literal.value());
    }
    return "(pipeline)";
  }

  private enum TokenType {
    FIELD,
    ROOT,
    STRING,
    NUMBER,
    IDENT,
    PIPE,
    LPAREN,
    RPAREN
  }

  private record Token(TokenType type, String text) {}

  private static List<Token> tokenize(String content, int line) throws TemplateParseException {
    List<Token> tokens = new ArrayList<>();
    int length = content.length();
    int i = 0;
    while (i < length) {
      char c = content.charAt(i);
      if (isSpace(c)) {
        i++;
      } else if (c == '|') {
        tokens.add(new Token(TokenType.PIPE, "|"));
        i++;
      } else if (c == '(') {
        tokens.add(new Token(TokenType.LPAREN, "("));
        i++;
      } else if (c == ')') {
        tokens.add(new Token(TokenType.RPAREN, ")"));
        i++;
      } else if (c == '"' || c == '`') {
        int end = skipQuoted(content, i, line);
        String raw = content.substring(i + 1, end);
        tokens.add(new Token(TokenType.STRING, c == '`' ? raw : unescape(raw, line)));
        i = end + 1;
      } else if (c == '.' && (i + 1 >= length || !Character.isDigit(content.charAt(i + 1)))) {
        int end = chainEnd(content, i);
        tokens.add(new Token(TokenType.FIELD, content.substring(i, end)));
        i = end;
      } else if (c == '$') {
        if (i + 1 < length && isIdentStart(content.charAt(i + 1))) {
          throw error(line, "template variables are not supported");
        }
        int end = i + 1 < length && content.charAt(i + 1) == '.' ? chainEnd(content, i + 1) : i + 1;
        tokens.add(new Token(TokenType.ROOT, content.substring(i, end)));
        i = end;
      } else if (Character.isDigit(c) || c == '.' || ((c == '-' || c == '+') && i + 1 < length
          && (Character.isDigit(content.charAt(i + 1)) || content.charAt(i + 1) == '.'))) {
        int end = i + 1;
        while (end < length && !isSpace(content.charAt(end)) && "|()".indexOf(content.charAt(end)) < 0) {
          end++;
        }
        String text = content.substring(i, end);
        if (!NUMBER.matcher(text).matches()) {
          throw error(line, "bad number syntax: " + text);
        }
        tokens.add(new Token(TokenType.NUMBER, text));
        i = end;
      } else if (isIdentStart(c)) {
        int end = i + 1;
        while (end < length && isIdentPart(content.charAt(end))) {
          end++;
        }
        tokens.add(new Token(TokenType.IDENT, content.substring(i, end)));
        i = end;
      } else {
        throw error(line, "unexpected \"" + c + "\" in command");
      }
    }
    return tokens;
  }

  /** Returns the end of a {@code .a.b} chain starting at {@code start}, which points at a dot. */
  private static int chainEnd(String content, int start) {
    int i = start;
    while (i < content.length() && content.charAt(i) == '.') {
      int j = i + 1;
      while (j < content.length() && isIdentPart(content.charAt(j))) {
        j++;
      }
      if (j == i + 1) {
        return i == start ? i + 1 : i;
      }
      i = j;
    }
    return i;
  }

  private static String unescape(String raw, int line) throws TemplateParseException {
    StringBuilder out = new StringBuilder(raw.length());
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c != '\\') {
        out.append(c);
        continue;
      }
      if (++i >= raw.length()) {
        throw error(line, "unterminated escape in string");
      }
      char e = raw.charAt(i);
      switch (e) {
        case 'n' -> out.append('\n');
        case 't' -> out.append('\t');
        case 'r' -> out.append('\r');
        case '"' -> out.append('"');
        case '\\' -> out.append('\\');
        default -> throw error(line, "unknown escape sequence \\" + e);
      }
    }
    return out.toString();
  }

  private static boolean isSpace(char c) {
    return c == ' ' || c == '\t' || c == '\r' || c == '\n';
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private static int newlines(String text) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        count++;
      }
    }
    return count;
  }

  private static TemplateParseException error(int line, String message) {
    return new TemplateParseException(line > 0 ? "line " + line + ": " + message : message);
  }
}
