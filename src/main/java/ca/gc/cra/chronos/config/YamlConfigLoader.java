package ca.gc.cra.chronos.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads chronos configuration from a YAML document and flattens it into key/value pairs.
 *
 * <p>The {@code common} section is merged with the section named after the command. Nested mappings become
 * dotted keys; lists become indexed keys, so
 * <pre>
 * meetingRules:
 *   - pattern: standup
 *     ticket: OPS-1
 * </pre>
 * yields {@code meetingRules.0.pattern=standup} and {@code meetingRules.0.ticket=OPS-1}.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode command name (reconcile, compare, adjust)
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection instanceof Map<?, ?> modeMap) {
        Map<String, String> overrides = new LinkedHashMap<>();
        flatten(asMap(modeMap, normalizedMode), "", overrides);
        replaceLists(flattened, overrides);
        flattened.putAll(overrides);
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      put(composite, entry.getValue(), target);
    }
  }

  private static void put(String composite, Object value, Map<String, String> target) {
    if (value == null) {
      target.put(composite, "");
    } else if (value instanceof Map<?, ?> nested) {
      flatten(asMap(nested, composite), composite, target);
    } else if (value instanceof Iterable<?> items) {
      int index = 0;
      for (Object item : items) {
        if (item instanceof Iterable<?>) {
          throw new IllegalArgumentException("YAML lists of lists are not supported for key " + composite);
        }
        put(composite + '.' + index++, item, target);
      }
    } else {
      target.put(composite, value.toString());
    }
  }

  /** A list in the command section replaces the whole list of the common section. */
  private static void replaceLists(Map<String, String> base, Map<String, String> overrides) {
    for (String key : overrides.keySet()) {
      int dot = key.indexOf('.');
      if (dot <= 0) {
        continue;
      }
      String root = key.substring(0, dot);
      base.keySet().removeIf(existing -> existing.startsWith(root + '.'));
    }
  }
}
