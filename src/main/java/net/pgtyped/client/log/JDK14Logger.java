package net.pgtyped.client.log;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.pgtyped.client.util.SecretDetector;

/**
 * {@link PQLogger} on top of java.util.logging. TRACE maps to FINEST, DEBUG to FINE and WARN to
 * WARNING. Records carry the class and method that called the logger.
 */
final class JDK14Logger implements PQLogger {
  private static final String LOGGER_CLASS = JDK14Logger.class.getName();

  // held so the level set by configure() survives; JUL only keeps loggers weakly
  private static final Logger packageLogger = Logger.getLogger(PQFormatter.CLASS_NAME_PREFIX);

  private static ConsoleHandler consoleHandler;

  private final Logger jdkLogger;

  JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  @Override
  public boolean isDebugEnabled() {
    return jdkLogger.isLoggable(Level.FINE);
  }

  @Override
  public boolean isTraceEnabled() {
    return jdkLogger.isLoggable(Level.FINEST);
  }

  @Override
  public void trace(String msg, Object... arguments) {
    log(Level.FINEST, msg, arguments);
  }

  @Override
  public void debug(String msg, Object... arguments) {
    log(Level.FINE, msg, arguments);
  }

  @Override
  public void warn(String msg, Object... arguments) {
    log(Level.WARNING, msg, arguments);
  }

  private void log(Level level, String msg, Object[] arguments) {
    if (!jdkLogger.isLoggable(level)) {
      return;
    }
    String message = SecretDetector.maskSecrets(fill(msg, ArgSupplier.evaluateAll(arguments)));
    StackTraceElement caller = findCaller();
    if (caller == null) {
      jdkLogger.log(level, message);
    } else {
      jdkLogger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    }
  }

  /**
   * Replaces each {@code {}} with the next argument. Placeholders without an argument are kept,
   * extra arguments are dropped.
   */
  static String fill(String msg, Object[] arguments) {
    if (msg == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(msg.length() + 32);
    int from = 0;
    int next = 0;
    int at;
    while ((at = msg.indexOf("{}", from)) >= 0) {
      sb.append(msg, from, at);
      if (next < arguments.length) {
        sb.append(arguments[next++]);
      } else {
        sb.append("{}");
      }
      from = at + 2;
    }
    return sb.append(msg, from, msg.length()).toString();
  }

  private static StackTraceElement findCaller() {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (!frame.getClassName().equals(LOGGER_CLASS)) {
        return frame;
      }
    }
    return null;
  }

  /**
   * Sets the level of the net.pgtyped loggers and publishes their records to stderr through
   * {@link PQFormatter}. The console handler is added on the first call that enables anything.
   *
   * @param level new level, OFF silences the loggers again
   */
  static synchronized void configure(PQLogLevel level) {
    packageLogger.setLevel(level.getJulLevel());
    if (consoleHandler == null && level != PQLogLevel.OFF) {
      consoleHandler = new ConsoleHandler();
      consoleHandler.setFormatter(new PQFormatter());
      packageLogger.addHandler(consoleHandler);
    }
    if (consoleHandler != null) {
      consoleHandler.setLevel(level.getJulLevel());
    }
  }

  static synchronized ConsoleHandler getConsoleHandler() {
    return consoleHandler;
  }

  // for tests
  static synchronized void removeConsoleHandler() {
    if (consoleHandler != null) {
      packageLogger.removeHandler(consoleHandler);
      consoleHandler = null;
    }
  }
}
