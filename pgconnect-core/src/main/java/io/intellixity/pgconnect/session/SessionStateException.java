package io.intellixity.pgconnect.session;

/** Raised when a session operation runs outside the session's open scope. */
public final class SessionStateException extends IllegalStateException {
  public SessionStateException(String message) {
    super(message);
  }
}
