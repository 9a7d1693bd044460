package com.gentoro.intake;

import com.gentoro.intake.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line parameters of the service.
 *
 * <p>Accepts {@code --key=value} and {@code --key value}; a trailing flag without a value is
 * stored as {@code "true"}. Known keys: {@code config-file}, {@code mode}, {@code file}, {@code
 * output-dir}.
 */
public final class StartupParameters {
  public static final String MODE_SERVER = "server";
  public static final String MODE_SINGLE = "single";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unexpected argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq >= 0) {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(body, args[++i]);
      } else {
        parameters.put(body, "true");
      }
    }
  }

  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) return null;
    if (type == String.class) return type.cast(raw);
    if (type == Integer.class) return type.cast(Integer.valueOf(raw));
    if (type == Boolean.class) return type.cast(Boolean.valueOf(raw));
    if (type == Path.class) return type.cast(Path.of(raw));
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public String mode() {
    String mode = getParameter("mode", String.class);
    return mode == null ? MODE_SERVER : mode.toLowerCase();
  }

  /** Explicit configuration file, or {@code null} to use the bundled {@code application.yaml}. */
  public Path configFile() {
    return getParameter("config-file", Path.class);
  }
}
