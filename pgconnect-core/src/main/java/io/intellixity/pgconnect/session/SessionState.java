package io.intellixity.pgconnect.session;

/** Lifecycle of a {@link DbSession}. Transitions only move forward. */
public enum SessionState {
  /** Constructed; no connection held yet. */
  NEW,

  /** Holding a live connection. */
  OPEN,

  /** Connection released. Terminal: a closed session is never reopened. */
  CLOSED
}
