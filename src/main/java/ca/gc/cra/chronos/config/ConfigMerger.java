package ca.gc.cra.chronos.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources, in that order of increasing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * <p>A CLI list key such as {@code nonMeetingHints} or {@code nonMeetingHints.0} replaces every YAML
   * entry of that list.</p>
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      String listRoot = listRoot(key);
      boolean overridesYaml = yamlCopy.containsKey(key)
          || yamlCopy.keySet().stream().anyMatch(k -> k.startsWith(listRoot + '.'));
      if (overridesYaml && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.keySet().removeIf(k -> !cliCopy.containsKey(k) && k.startsWith(listRoot + '.'));
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static String listRoot(String key) {
    int dot = key.indexOf('.');
    return dot > 0 ? key.substring(0, dot) : key;
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (parseBoolean(effective.get("submit")) && trim(effective.get("ticketingFile")).isEmpty()) {
      throw new IllegalArgumentException("submit=true requires ticketingFile");
    }
    if ("adjust".equalsIgnoreCase(mode)
        && parseBoolean(effective.get("apply"))
        && trim(effective.get("ticketingFile")).isEmpty()) {
      throw new IllegalArgumentException("apply=true requires ticketingFile");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
