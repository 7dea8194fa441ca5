package ca.gc.cra.chronos.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Streaming JSON reader and writer over plain {@link Map}/{@link List} graphs.
 * <p><strong>Why:</strong> The file adapters hold small documents whose shape is checked field by field; a
 * generic graph plus typed accessors keeps each adapter's mapping readable.</p>
 * <p><strong>Thread-safety:</strong> Safe to share; the underlying {@link JsonFactory} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON document into maps, lists, strings, numbers, booleans and {@code null}s.
   *
   * @param json document; never {@code null}
   * @return parsed graph; an empty document yields an empty map
   * @throws IOException when the document is not valid JSON or has trailing content
   */
  public Object parse(String json) throws IOException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IOException("JSON document contains trailing content");
      }
      return value;
    }
  }

  /**
   * Renders a graph of maps, lists, strings, numbers, booleans and {@code null}s, pretty-printed.
   *
   * @param value graph to render
   * @return JSON text
   * @throws IOException when the graph holds an unsupported value type
   */
  public String write(Object value) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.useDefaultPrettyPrinter();
      writeValue(generator, value);
    }
    return out.toString();
  }

  /** Returns the list under {@code key}, or an empty list when absent or not a list. */
  public static List<Object> list(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (value instanceof List<?> list) {
      return new ArrayList<>(list);
    }
    return List.of();
  }

  /** Narrows a parsed value to an object; anything else yields an empty map. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> object(Object value) {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    return Map.of();
  }

  /** Returns the text under {@code key}; numbers are rendered, anything else yields {@code ""}. */
  public static String text(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Number n) {
      return n.toString();
    }
    return "";
  }

  /**
   * Returns the number under {@code key}, accepting numeric strings.
   *
   * @throws IllegalArgumentException when the value is present but not numeric
   */
  public static double number(Map<String, Object> object, String key, double fallback) {
    Object value = object.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    String raw = value.toString().trim();
    if (raw.isEmpty()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " is not a number: " + raw, ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IOException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    for (JsonToken token = parser.nextToken(); token != JsonToken.END_OBJECT; token = parser.nextToken()) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name but found " + token);
      }
      String field = parser.getCurrentName();
      map.put(field, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    for (JsonToken token = parser.nextToken(); token != JsonToken.END_ARRAY; token = parser.nextToken()) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof List<?> list) {
      generator.writeStartArray();
      for (Object item : list) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else if (value instanceof String s) {
      generator.writeString(s);
    } else if (value instanceof Integer || value instanceof Long) {
      generator.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number n) {
      generator.writeNumber(n.doubleValue());
    } else if (value instanceof Boolean b) {
      generator.writeBoolean(b);
    } else {
      throw new IOException("Unsupported value type: " + value.getClass().getName());
    }
  }
}
