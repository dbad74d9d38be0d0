package net.pgtyped.common.core;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads a message resource bundle once per bundle name and formats its entries with {@link
 * MessageFormat}.
 */
public class ResourceBundleManager {
  private static final Map<String, ResourceBundleManager> resourceManagers =
      new ConcurrentHashMap<>();

  private final String bundleName;

  private final ResourceBundle resourceBundle;

  private ResourceBundleManager(String bundleName) {
    this.bundleName = bundleName;
    this.resourceBundle = loadBundle(bundleName);
  }

  /**
   * Get the manager for a bundle. The bundle is loaded on first use.
   *
   * @param bundleName fully qualified bundle base name
   * @return the shared manager for that bundle
   */
  public static ResourceBundleManager getSingleton(String bundleName) {
    return resourceManagers.computeIfAbsent(bundleName, ResourceBundleManager::new);
  }

  private static ResourceBundle loadBundle(String bundleName) {
    try {
      return ResourceBundle.getBundle(
          bundleName, Locale.getDefault(), ResourceBundleManager.class.getClassLoader());
    } catch (MissingResourceException ex) {
      return null;
    }
  }

  /**
   * Get the message for a key, formatted with the given arguments. Unknown keys and a missing
   * bundle produce a placeholder message instead of failing, so an error can always be reported.
   *
   * @param key message key
   * @param args format arguments
   * @return formatted message
   */
  public String getLocalizedMessage(String key, Object... args) {
    String pattern = getLocalizedMessage(key);
    if (args == null || args.length == 0) {
      return pattern;
    }
    try {
      return MessageFormat.format(pattern, args);
    } catch (IllegalArgumentException ex) {
      return pattern;
    }
  }

  public String getLocalizedMessage(String key) {
    if (resourceBundle == null) {
      return "!!missing resource bundle: " + bundleName + "!!";
    }
    try {
      return resourceBundle.getString(key);
    } catch (MissingResourceException ex) {
      return "!!missing resource: " + key + "!!";
    }
  }

  public String getBundleName() {
    return bundleName;
  }
}
