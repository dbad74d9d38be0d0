package net.pgtyped.client.util;

@FunctionalInterface
public interface ThrowingFunction<A, R, T extends Throwable> {
  R apply(A a) throws T;
}
