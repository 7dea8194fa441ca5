package ca.gc.cra.chronos.api;

import ca.gc.cra.chronos.application.calendar.MeetingFilter;
import ca.gc.cra.chronos.config.ChronosConfig;
import ca.gc.cra.chronos.config.ConfigMerger;
import ca.gc.cra.chronos.config.YamlConfigLoader;
import ca.gc.cra.chronos.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared argument, configuration and error handling of the chronos commands.
 *
 * <p>Arguments are merged as defaults &lt; YAML ({@code config=PATH}, section named after the command) &lt;
 * CLI {@code key=value}. Boolean flags such as {@code --apply} become {@code apply=true}.</p>
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  /** Body of a command once its configuration is resolved. */
  @FunctionalInterface
  interface Command {
    ExitCode execute(ChronosConfig config) throws IOException;
  }

  private CommandSupport() {}

  /**
   * Parses {@code args}, resolves the configuration and runs {@code command}, mapping failures to exit codes.
   *
   * @param mode command name; also the YAML section
   * @param args raw arguments after the command name
   * @param usage one-line usage printed on argument errors
   * @param help full help text
   * @param flagKeys boolean flags accepted by the command, without the leading dashes
   * @param command command body
   * @return exit code
   */
  static ExitCode run(
      String mode, String[] args, String usage, String help, Iterable<String> flagKeys, Command command) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(help.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", mode);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    for (String flag : flagKeys) {
      if (input.hasFlag("--" + flag)) {
        kv.put(flag, "true");
      }
    }

    ChronosConfig config;
    try {
      config = ChronosConfig.fromMap(effectiveConfig(mode, kv));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      return command.execute(config);
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} failed reading or writing its sources", mode, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv) throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    Map<String, String> defaults = ChronosConfig.defaultsAsFlatMap(MeetingFilter.DEFAULT_NON_MEETING_HINTS);
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, defaults, log::warn);
  }

  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
