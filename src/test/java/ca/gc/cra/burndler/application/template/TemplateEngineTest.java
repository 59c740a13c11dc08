package ca.gc.cra.burndler.application.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.testing.FixedClock;
import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateEngineTest {
  private final TemplateEngine engine = new TemplateEngine(
      TemplateFunctions.standard(new FixedClock(), new SecureRandom(), name -> null),
      new YamlSupport(),
      new JsonSupport());

  @Test
  void substitutesNestedFields() throws TemplateException {
    String out = engine.render("Hello {{ .service.name }}!", "text", Map.of("service", Map.of("name", "api")));

    assertEquals("Hello api!", out);
  }

  @Test
  void missingKeyIsAnExecutionError() {
    TemplateExecutionException ex = assertThrows(TemplateExecutionException.class,
        () -> engine.render("port: {{.Missing}}\n", "text", Map.of("Port", 1)));

    assertTrue(ex.getMessage().contains("map has no entry for key \"Missing\""), ex.getMessage());
  }

  @Test
  void missingNestedKeyIsAnExecutionError() {
    TemplateExecutionException ex = assertThrows(TemplateExecutionException.class,
        () -> engine.render("{{ .db.host }}", "text", Map.of("db", Map.of("port", 5432))));

    assertTrue(ex.getMessage().contains("map has no entry for key \"host\""), ex.getMessage());
  }

  @Test
  void nullValuePrintsEmptyButItsFieldsAreAnError() throws TemplateException {
    Map<String, Object> vars = Collections.singletonMap("db", null);

    assertEquals("[]", engine.render("[{{ .db }}]", "text", vars));
    TemplateExecutionException ex = assertThrows(TemplateExecutionException.class,
        () -> engine.render("{{ .db.host }}", "text", vars));
    assertTrue(ex.getMessage().contains("nil pointer evaluating .db.host"), ex.getMessage());
  }

  @Test
  void ifElseChainsPickFirstTruthyBranch() throws TemplateException {
    String template = "{{ if .debug }}debug{{ else if .verbose }}verbose{{ else }}quiet{{ end }}";

    assertEquals("debug", engine.render(template, "text", Map.of("debug", true)));
    assertEquals("verbose", engine.render(template, "text", Map.of("debug", 0, "verbose", "yes")));
    assertEquals("quiet", engine.render(template, "text", Map.of("debug", false, "verbose", "")));
  }

  @Test
  void rangeRebindsDotAndKeepsRootReachable() throws TemplateException {
    String out = engine.render("{{ range .items }}{{ $.prefix }}-{{ . }} {{ end }}", "text",
        Map.of("prefix", "p", "items", List.of("a", "b")));

    assertEquals("p-a p-b ", out);
  }

  @Test
  void rangeOverMapVisitsValuesInKeyOrder() throws TemplateException {
    String out = engine.render("{{ range .ports }}{{ . }};{{ end }}", "text",
        Map.of("ports", Map.of("web", 80, "api", 8080, "db", 5432)));

    assertEquals("8080;5432;80;", out);
  }

  @Test
  void rangeElseRunsForEmptyInput() throws TemplateException {
    assertEquals("none", engine.render("{{ range .items }}x{{ else }}none{{ end }}", "text",
        Map.of("items", List.of())));
  }

  @Test
  void withNarrowsDot() throws TemplateException {
    String out = engine.render("{{ with .db }}{{ .host }}:{{ .port }}{{ else }}no db{{ end }}", "text",
        Map.of("db", Map.of("host", "pg", "port", 5432)));

    assertEquals("pg:5432", out);
    assertEquals("no db", engine.render("{{ with .db }}x{{ else }}no db{{ end }}", "text", Map.of("db", Map.of())));
  }

  @Test
  void trimMarkersAndCommentsDropWhitespace() throws TemplateException {
    String out = engine.render("a  {{- .x -}}  b{{/* note */}}", "text", Map.of("x", "X"));

    assertEquals("aXb", out);
  }

  @Test
  void pipelinesPassValueAsLastArgument() throws TemplateException {
    Map<String, Object> vars = Map.of("name", "svc", "port", "");

    assertEquals("SVC", engine.render("{{ .name | upper }}", "text", vars));
    assertEquals("8080", engine.render("{{ .port | default 8080 }}", "text", vars));
  }

  @Test
  void customFunctionsCanBeAdded() throws TemplateException {
    TemplateFunctions functions = TemplateFunctions.standard()
        .with("suffix", args -> args.get(0) + "-1");
    TemplateEngine custom = new TemplateEngine(functions, new YamlSupport(), new JsonSupport());

    assertEquals("svc-1", custom.render("{{ suffix .name }}", "text", Map.of("name", "svc")));
  }

  @Test
  void unknownFunctionFailsAtParseTime() {
    TemplateParseException ex = assertThrows(TemplateParseException.class,
        () -> engine.render("{{ nope .x }}", "text", Map.of()));

    assertTrue(ex.getMessage().contains("function \"nope\" not defined"), ex.getMessage());
  }

  @Test
  void unterminatedBlockFailsAtParseTime() {
    TemplateParseException ex = assertThrows(TemplateParseException.class,
        () -> engine.render("{{ if .x }}open", "text", Map.of()));

    assertTrue(ex.getMessage().contains("unexpected EOF"), ex.getMessage());
  }

  @Test
  void yamlOutputIsReserializedWithSortedKeys() throws TemplateException {
    String out = engine.render("zeta: {{ .z }}\nalpha: 1\n", "yaml", Map.of("z", 2));

    assertEquals("alpha: 1\nzeta: 2\n", out);
  }

  @Test
  void invalidYamlAfterRenderingIsAStructureError() {
    assertThrows(TemplateStructureException.class,
        () -> engine.render("key: [unclosed\n", "yaml", Map.of()));
  }

  @Test
  void jsonOutputIsValidatedAndPretty() throws TemplateException {
    String out = engine.render("{\"b\": {{ .b }}, \"a\": \"x\"}", "json", Map.of("b", 1));

    assertTrue(out.indexOf("\"a\"") < out.indexOf("\"b\""), out);
    assertTrue(out.contains("\n  \"a\""), out);
  }

  @Test
  void emptyOrBrokenJsonIsAStructureError() {
    TemplateStructureException empty = assertThrows(TemplateStructureException.class,
        () -> engine.render("{{ .nothing }}", "json", Map.of()));
    assertEquals("invalid JSON after rendering: empty document", empty.getMessage());
    assertThrows(TemplateStructureException.class, () -> engine.render("{\"a\": ", "json", Map.of()));
  }

  @Test
  void envOutputIsVerbatim() throws TemplateException {
    assertEquals("B=2\nA=1\n", engine.render("B={{ .b }}\nA=1\n", "env", Map.of("b", 2)));
  }

  @Test
  void unknownFormatIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> engine.render("x", "xml", Map.of()));
  }
}
