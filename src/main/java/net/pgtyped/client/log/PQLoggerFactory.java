package net.pgtyped.client.log;

import static net.pgtyped.client.util.PQUtil.systemGetProperty;

/**
 * Hands out {@link PQLogger}s. java.util.logging is the default backend; {@code
 * -Dnet.pgtyped.logger=slf4j} routes everything to SLF4J instead. With the JUL backend, {@code
 * -Dnet.pgtyped.logLevel=debug} (any {@link PQLogLevel}) turns on console output for the
 * net.pgtyped loggers.
 */
public final class PQLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.pgtyped.logger";
  public static final String LOG_LEVEL_PROPERTY = "net.pgtyped.logLevel";

  private static Backend backend;

  enum Backend {
    JUL,
    SLF4J;

    static Backend fromName(String name) {
      return name != null && "slf4j".equalsIgnoreCase(name.trim()) ? SLF4J : JUL;
    }
  }

  private PQLoggerFactory() {}

  public static PQLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  public static PQLogger getLogger(String name) {
    if (getBackend() == Backend.SLF4J) {
      return new SLF4JLogger(name);
    }
    return new JDK14Logger(name);
  }

  static synchronized Backend getBackend() {
    if (backend == null) {
      backend = Backend.fromName(systemGetProperty(LOGGER_IMPL_PROPERTY));
      if (backend == Backend.JUL) {
        applyLevelProperty();
      }
    }
    return backend;
  }

  private static void applyLevelProperty() {
    String value = systemGetProperty(LOG_LEVEL_PROPERTY);
    if (value == null) {
      return;
    }
    PQLogLevel level = PQLogLevel.fromName(value);
    if (level == null) {
      new JDK14Logger(PQLoggerFactory.class.getName())
          .warn(
              "Ignoring {}={}, expected one of OFF, ERROR, WARN, INFO, DEBUG, TRACE",
              LOG_LEVEL_PROPERTY,
              value);
      return;
    }
    JDK14Logger.configure(level);
  }

  // for tests
  static synchronized void reset() {
    backend = null;
  }
}
