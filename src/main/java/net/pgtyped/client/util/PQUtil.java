package net.pgtyped.client.util;

import java.nio.charset.StandardCharsets;

/** Small helpers shared across the client. Must not log: the logger factory depends on it. */
public class PQUtil {
  /**
   * System.getProperty wrapper. If System.getProperty raises a SecurityException, it is ignored
   * and returns null.
   *
   * @param property the property name
   * @return the property value if set, otherwise null.
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      return null;
    }
  }

  /**
   * Decode driver-supplied text. libpq reports tags and diagnostics in the client encoding, which
   * the client always sets to UTF8.
   *
   * @param bytes raw bytes, may be null
   * @return decoded text, or null for null input
   */
  public static String decodeUtf8(byte[] bytes) {
    return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
  }
}
