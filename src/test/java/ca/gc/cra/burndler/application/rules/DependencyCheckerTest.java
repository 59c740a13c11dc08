package ca.gc.cra.burndler.application.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.domain.rules.DependencyRule;
import ca.gc.cra.burndler.domain.rules.ValidationError;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DependencyCheckerTest {
  private final DependencyChecker checker = new DependencyChecker();

  @Test
  void requiresReportsMissingTarget() {
    DependencyRule rule = new DependencyRule("requires", "tls.enabled", "", "tls.cert", "");

    List<ValidationError> errors = checker.check(List.of(rule), Map.of("tls", Map.of("enabled", true)));

    assertEquals(List.of(new ValidationError("tls.cert", "tls.enabled requires tls.cert to be set", "requires")),
        errors);
  }

  @Test
  void requiresChecksTargetWheneverConditionHolds() {
    DependencyRule rule = new DependencyRule("requires", "backup", "{{.mode}} == \"ha\"", "replica", "");

    List<ValidationError> errors = checker.check(List.of(rule), Map.of("mode", "ha"));

    assertEquals(List.of(new ValidationError("replica", "backup requires replica to be set", "requires")), errors);
    assertTrue(checker.check(List.of(rule), Map.of("mode", "ha", "replica", "db-2")).isEmpty());
  }

  @Test
  void requiresWithoutConditionIgnoresSourceField() {
    DependencyRule rule = new DependencyRule("requires", "tls.enabled", "", "tls.cert", "");

    assertEquals(1, checker.check(List.of(rule), Map.of()).size());
    assertTrue(checker.check(List.of(rule), Map.of("tls", Map.of("cert", "/etc/tls.pem"))).isEmpty());
  }

  @Test
  void conflictsUsesCustomMessageAndReportsTarget() {
    DependencyRule rule = new DependencyRule("conflicts", "sqlite", "", "postgres", "pick one database");

    List<ValidationError> errors = checker.check(List.of(rule), Map.of("sqlite", "on", "postgres", "on"));

    assertEquals(List.of(new ValidationError("postgres", "pick one database", "conflicts")), errors);
  }

  @Test
  void conflictsFiresOnTargetAloneWhenConditionHolds() {
    DependencyRule rule = new DependencyRule("conflicts", "sqlite", "", "postgres", "");

    assertEquals(List.of(new ValidationError("postgres", "sqlite conflicts with postgres", "conflicts")),
        checker.check(List.of(rule), Map.of("postgres", "on")));
    assertTrue(checker.check(List.of(rule), Map.of("sqlite", "on")).isEmpty());
  }

  @Test
  void conditionGatesTheRule() {
    DependencyRule rule = new DependencyRule("requires", "replicas", "{{.mode}} == 'cluster'", "leader", "");

    assertTrue(checker.check(List.of(rule), Map.of("mode", "single", "replicas", 3)).isEmpty());
    assertEquals(1, checker.check(List.of(rule), Map.of("mode", "cluster", "replicas", 3)).size());
  }

  @Test
  void unknownRuleTypeAndBadConditionBecomeErrors() {
    DependencyRule unknown = new DependencyRule("implies", "a", "", "b", "");
    DependencyRule broken = new DependencyRule("requires", "a", "{{.a}} ~ 1", "b", "");

    List<ValidationError> errors = checker.check(List.of(unknown, broken), Map.of("a", 1));

    assertEquals(2, errors.size());
    assertEquals("Unknown rule type: implies", errors.get(0).message());
    assertTrue(errors.get(1).message().startsWith("Failed to evaluate condition:"), errors.get(1).message());
  }

  @Test
  void cascadesNeverFails() {
    DependencyRule rule = new DependencyRule("cascades", "a", "", "b", "");

    assertTrue(checker.check(List.of(rule), Map.of("a", "x")).isEmpty());
  }

  @Test
  void evaluateConditionExposesTheConditionLanguage() throws ConditionException {
    assertTrue(checker.evaluateCondition("{{.gpu.count}} > 0", Map.of("gpu", Map.of("count", 2))));
    assertFalse(checker.evaluateCondition("{{.gpu.count}} > 0", Map.of()));
    assertTrue(checker.evaluateCondition("", Map.of()));
    assertThrows(ConditionException.class, () -> checker.evaluateCondition("gpu", Map.of()));
  }
}
