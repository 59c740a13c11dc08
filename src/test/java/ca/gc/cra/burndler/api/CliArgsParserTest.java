package ca.gc.cra.burndler.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"target=shop", " catalog = c.yaml ", "", "out="});
    assertEquals(List.of("target", "catalog", "out"), List.copyOf(map.keySet()));
    assertEquals("c.yaml", map.get("catalog"));
    assertEquals("", map.get("out"));
  }

  @Test
  void laterDuplicateWins() {
    assertEquals("b", CliArgsParser.toMap(new String[] {"in=a", "in=b"}).get("in"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"target"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=shop"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a\u0001b"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a.yaml\u0001"}));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void cliInputSeparatesHelpAndVerboseFlags() {
    CliInput input = CliInput.parse(new String[] {"in=a.yaml", "-V", "HELP", " ", null});
    assertTrue(input.help());
    assertTrue(input.verbose());
    assertEquals(List.of("in=a.yaml"), List.of(input.keyValueArgs()));
  }

  @Test
  void unknownFlagsReachTheParserAndAreRejected() {
    CliInput input = CliInput.parse(new String[] {"--dry-run"});
    assertFalse(input.help());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(input.keyValueArgs()));
  }
}
