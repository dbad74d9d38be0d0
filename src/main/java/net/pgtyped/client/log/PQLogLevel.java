package net.pgtyped.client.log;

import java.util.Locale;
import java.util.logging.Level;

/** Values of the {@value PQLoggerFactory#LOG_LEVEL_PROPERTY} switch. */
public enum PQLogLevel {
  OFF(Level.OFF),
  ERROR(Level.SEVERE),
  WARN(Level.WARNING),
  INFO(Level.INFO),
  DEBUG(Level.FINE),
  TRACE(Level.FINEST);

  private final Level julLevel;

  PQLogLevel(Level julLevel) {
    this.julLevel = julLevel;
  }

  /**
   * @param name level name, case insensitive, surrounding blanks ignored
   * @return the level, or null if the name is not one of the constants
   */
  public static PQLogLevel fromName(String name) {
    if (name == null) {
      return null;
    }
    String wanted = name.trim().toUpperCase(Locale.ROOT);
    for (PQLogLevel level : values()) {
      if (level.name().equals(wanted)) {
        return level;
      }
    }
    return null;
  }

  public Level getJulLevel() {
    return julLevel;
  }
}
