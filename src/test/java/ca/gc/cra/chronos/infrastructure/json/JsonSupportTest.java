package ca.gc.cra.chronos.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedGraphPreservingFieldOrder() throws IOException {
    Map<String, Object> root = JsonSupport.object(
        json.parse("{\"b\": [1, \"two\", true, null], \"a\": {\"x\": 2.5}}"));

    assertEquals(List.of("b", "a"), List.copyOf(root.keySet()));
    List<Object> items = JsonSupport.list(root, "b");
    assertEquals(1, ((Number) items.get(0)).intValue());
    assertEquals("two", items.get(1));
    assertEquals(Boolean.TRUE, items.get(2));
    assertNull(items.get(3));
    assertEquals(2.5, JsonSupport.number(JsonSupport.object(root.get("a")), "x", 0));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    assertEquals(Map.of(), json.parse(""));
  }

  @Test
  void malformedDocumentIsRejected() {
    assertThrows(IOException.class, () -> json.parse("{\"a\": "));
  }

  @Test
  void accessorsTolerateMissingAndMistypedValues() {
    Map<String, Object> node = Map.of("n", 7, "s", "3.5", "list", "not a list");

    assertEquals("7", JsonSupport.text(node, "n"));
    assertEquals("", JsonSupport.text(node, "missing"));
    assertEquals(3.5, JsonSupport.number(node, "s", 0));
    assertEquals(9.0, JsonSupport.number(node, "missing", 9));
    assertTrue(JsonSupport.list(node, "list").isEmpty());
    assertTrue(JsonSupport.object("text").isEmpty());
  }

  @Test
  void nonNumericStringIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JsonSupport.number(Map.of("sickDays", "half"), "sickDays", 0));

    assertEquals("sickDays is not a number: half", ex.getMessage());
  }

  @Test
  void writtenGraphParsesBack() throws IOException {
    Map<String, Object> graph = new LinkedHashMap<>();
    graph.put("key", "ABC-1");
    graph.put("seconds", 2700L);
    graph.put("tags", Arrays.asList("a", null));

    Map<String, Object> parsed = JsonSupport.object(json.parse(json.write(graph)));

    assertEquals("ABC-1", parsed.get("key"));
    assertEquals(2700L, ((Number) parsed.get("seconds")).longValue());
    assertEquals(Arrays.asList("a", null), parsed.get("tags"));
  }

  @Test
  void unsupportedValueTypeIsRejected() {
    assertThrows(IOException.class, () -> json.write(Map.of("when", new Object())));
  }
}
