package net.pgtyped.client.log;

/**
 * Logger used inside the result core. Messages take SLF4J style {@code {}} placeholders; an
 * argument that is an {@link ArgSupplier} is only evaluated when the level is enabled. Formatted
 * messages pass through {@link net.pgtyped.client.util.SecretDetector} before they are published.
 */
public interface PQLogger {
  boolean isDebugEnabled();

  boolean isTraceEnabled();

  void trace(String msg, Object... arguments);

  void debug(String msg, Object... arguments);

  void warn(String msg, Object... arguments);
}
