package net.pgtyped.client.log;

/**
 * Deferred log argument: {@code logger.debug("Statement failed: {}", (ArgSupplier) () ->
 * describe(result))} only builds the description when DEBUG is on.
 */
@FunctionalInterface
public interface ArgSupplier {
  Object get();

  static Object[] evaluateAll(Object[] args) {
    Object[] values = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      values[i] = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
    }
    return values;
  }
}
