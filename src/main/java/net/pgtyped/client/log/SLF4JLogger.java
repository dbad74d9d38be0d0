package net.pgtyped.client.log;

import net.pgtyped.client.util.SecretDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/** {@link PQLogger} that forwards to SLF4J, for applications that bind their own backend. */
final class SLF4JLogger implements PQLogger {
  private final Logger slf4jLogger;

  SLF4JLogger(String name) {
    this.slf4jLogger = LoggerFactory.getLogger(name);
  }

  @Override
  public boolean isDebugEnabled() {
    return slf4jLogger.isDebugEnabled();
  }

  @Override
  public boolean isTraceEnabled() {
    return slf4jLogger.isTraceEnabled();
  }

  @Override
  public void trace(String msg, Object... arguments) {
    if (slf4jLogger.isTraceEnabled()) {
      slf4jLogger.trace(format(msg, arguments));
    }
  }

  @Override
  public void debug(String msg, Object... arguments) {
    if (slf4jLogger.isDebugEnabled()) {
      slf4jLogger.debug(format(msg, arguments));
    }
  }

  @Override
  public void warn(String msg, Object... arguments) {
    if (slf4jLogger.isWarnEnabled()) {
      slf4jLogger.warn(format(msg, arguments));
    }
  }

  Logger getDelegate() {
    return slf4jLogger;
  }

  private static String format(String msg, Object[] arguments) {
    return SecretDetector.maskSecrets(
        MessageFormatter.arrayFormat(msg, ArgSupplier.evaluateAll(arguments)).getMessage());
  }
}
