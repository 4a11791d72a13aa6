package com.gentoro.graphguard;

import com.gentoro.graphguard.config.ConfigurationProvider;
import com.gentoro.graphguard.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line arguments in {@code --name value} form. Switches ({@code --no-confirm}, {@code
 * --keep-partial}, {@code --verbose}) take no value; {@code --name=value} is accepted as well.
 */
public class StartupParameters {
  private static final Set<String> SWITCHES = Set.of("no-confirm", "keep-partial", "verbose");
  private static final Set<String> OPTIONS =
      Set.of("action", "graph_id", "uuid", "output", "config-file");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      String argument = arguments[p];
      if (!argument.startsWith("--")) {
        throw new ValidationException("Unexpected argument: " + argument);
      }

      String paramName = argument.substring(2);
      String paramValue = null;
      int eq = paramName.indexOf('=');
      if (eq >= 0) {
        paramValue = paramName.substring(eq + 1);
        paramName = paramName.substring(0, eq);
      }
      // --graph-id and --graph_id are interchangeable
      if ("graph-id".equals(paramName)) {
        paramName = "graph_id";
      }

      if ("help".equals(paramName) && paramValue == null) {
        result.put("action", Action.HELP.cliName());
        continue;
      }
      if (SWITCHES.contains(paramName)) {
        if (paramValue != null) {
          throw new ValidationException("--" + paramName + " does not take a value");
        }
        result.put(paramName, Boolean.TRUE);
        continue;
      }
      if (!OPTIONS.contains(paramName)) {
        throw new ValidationException("Unknown option: --" + paramName);
      }
      if (paramValue == null) {
        if (p == arguments.length - 1 || arguments[p + 1].startsWith("--")) {
          throw new ValidationException("Missing value for --" + paramName);
        }
        paramValue = arguments[++p];
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object actionName = parameters.get("action");
    if (actionName == null) {
      throw new ValidationException("Missing --action; expected one of: " + Action.choices());
    }
    Action action =
        Action.fromCliName(actionName.toString())
            .orElseThrow(
                () ->
                    new ValidationException(
                        "Invalid action: " + actionName + "; expected one of: "
                            + Action.choices()));

    if (action.requiresUuid() && isBlank("uuid")) {
      throw new ValidationException("--uuid is required for " + action.cliName());
    }
    if (action == Action.EXPORT && isBlank("output")) {
      throw new ValidationException("--output is required for export");
    }
    if (isBlank("config-file")) {
      throw new ValidationException("Missing config file location");
    }
  }

  private boolean isBlank(String name) {
    Object value = parameters.get(name);
    return value == null || value.toString().isBlank();
  }

  public Action action() {
    return Action.fromCliName(getParameter("action", String.class)).orElseThrow();
  }

  /** Graph id given on the command line, if any. */
  public Optional<String> graphId() {
    return getOptionalParameter("graph_id", String.class).filter(s -> !s.isBlank());
  }

  public Optional<String> uuid() {
    return getOptionalParameter("uuid", String.class).map(String::trim);
  }

  public Optional<String> output() {
    return getOptionalParameter("output", String.class);
  }

  public boolean skipConfirmation() {
    return isParameterPresent("no-confirm");
  }

  public boolean keepPartial() {
    return isParameterPresent("keep-partial");
  }

  public boolean verbose() {
    return isParameterPresent("verbose");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/graphguard.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
