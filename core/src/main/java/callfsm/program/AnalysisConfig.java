package callfsm.program;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings shared by the builders and the instrumentation.
 *
 * <p>Defaults come from the {@code callfsm/analysis.properties} classpath
 * resource. Any key can be overridden with a system property of the same name
 * prefixed by {@code callfsm.} (eg. {@code -Dcallfsm.entry.function=run}).
 */
public final class AnalysisConfig {

  public static final String DEFAULTS_RESOURCE = "callfsm/analysis.properties";
  public static final String SYSTEM_PROPERTY_PREFIX = "callfsm.";

  public static final String ENTRY_FUNCTION = "entry.function";
  public static final String SYSCALL_FUNCTION = "syscall.function";
  public static final String DUMMY_SYSCALL_FUNCTION = "dummy.syscall.function";
  public static final String DUMMY_SYSCALL_OWNER = "dummy.syscall.owner";
  public static final String TERMINATING_CALLS = "terminating.calls";
  public static final String LIBRARY_CALLS = "library.calls";

  private final Properties properties;

  private AnalysisConfig(Properties properties) {
    this.properties = properties;
  }

  /**
   * Defaults, overridden by {@code callfsm.*} system properties.
   */
  public static AnalysisConfig load() {
    final Properties properties = defaults();
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith(SYSTEM_PROPERTY_PREFIX)) {
        properties.setProperty(key.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(key));
      }
    }
    return new AnalysisConfig(properties);
  }

  /**
   * Defaults, overridden by explicit settings (system properties are ignored).
   *
   * @param overrides settings taking precedence over the defaults
   */
  public static AnalysisConfig of(Properties overrides) {
    final Properties properties = defaults();
    for (String key : overrides.stringPropertyNames()) {
      properties.setProperty(key, overrides.getProperty(key));
    }
    return new AnalysisConfig(properties);
  }

  private static Properties defaults() {
    final var properties = new Properties();
    try (InputStream input = AnalysisConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (input == null) {
        throw new IllegalStateException(DEFAULTS_RESOURCE + " is missing from the classpath");
      }
      properties.load(input);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read " + DEFAULTS_RESOURCE, e);
    }
    return properties;
  }

  /**
   * Simple name of the function where execution starts.
   */
  public String entryFunction() {
    return require(ENTRY_FUNCTION);
  }

  /**
   * Simple name of the function performing raw system calls.
   */
  public String syscallFunction() {
    return require(SYSCALL_FUNCTION);
  }

  /**
   * Simple name of the hook inserted by instrumentation.
   */
  public String dummySyscallFunction() {
    return require(DUMMY_SYSCALL_FUNCTION);
  }

  /**
   * Internal name of the class declaring the instrumentation hook.
   */
  public String dummySyscallOwner() {
    return require(DUMMY_SYSCALL_OWNER);
  }

  /**
   * Names of library calls which end the process.
   */
  public Set<String> terminatingCalls() {
    return Arrays
      .stream(require(TERMINATING_CALLS).split(","))
      .map(String::strip)
      .filter(name -> !name.isEmpty())
      .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Classpath resource listing the library calls.
   */
  public String libraryCallsResource() {
    return require(LIBRARY_CALLS);
  }

  private String require(String key) {
    final String value = properties.getProperty(key);
    if (value == null) {
      throw new IllegalStateException("missing setting " + key);
    }
    return value.strip();
  }
}
