package io.intellixity.pgconnect.session;

/** Body of a scoped session; see {@link DbSession#use(SessionWork)}. */
@FunctionalInterface
public interface SessionWork<T> {
  T run(DbSession session);
}
