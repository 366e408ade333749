package io.intellixity.pgconnect.exec;

import java.util.Objects;

/**
 * Where a session connects: a connection URI (e.g. {@code postgresql://user:pw@host:5432/db}
 * or a {@code jdbc:postgresql:} URL) and optional credentials that override the URI's own.
 */
public record ConnectionTarget(String uri, String user, String password) {
  public ConnectionTarget {
    Objects.requireNonNull(uri, "uri");
    if (uri.isBlank()) throw new IllegalArgumentException("Connection uri must not be blank");
    user = (user == null || user.isBlank()) ? null : user;
    password = (password == null || password.isEmpty()) ? null : password;
  }

  public static ConnectionTarget of(String uri) {
    return new ConnectionTarget(uri, null, null);
  }

  /** URI with any inline password replaced, safe for logs. */
  public String describe() {
    String u = redact(uri);
    return (user == null) ? u : u + " (user=" + user + ")";
  }

  /**
   * Masks the password in a connection URI or JDBC URL: the {@code user:pw@} userinfo part and
   * any {@code password=} query parameter.
   */
  public static String redact(String uri) {
    if (uri == null) return null;
    return maskQueryPassword(maskUserInfoPassword(uri));
  }

  @Override
  public String toString() {
    return "ConnectionTarget[" + describe() + "]";
  }

  private static String maskUserInfoPassword(String uri) {
    int scheme = uri.indexOf("://");
    if (scheme < 0) return uri;
    int start = scheme + 3;
    int at = uri.indexOf('@', start);
    int slash = uri.indexOf('/', start);
    int query = uri.indexOf('?', start);
    if (at < 0 || (slash >= 0 && slash < at) || (query >= 0 && query < at)) return uri;
    int colon = uri.indexOf(':', start);
    if (colon < 0 || colon > at) return uri;
    return uri.substring(0, colon + 1) + "****" + uri.substring(at);
  }

  private static String maskQueryPassword(String uri) {
    int q = uri.indexOf('?');
    if (q < 0) return uri;
    String[] params = uri.substring(q + 1).split("&", -1);
    for (int i = 0; i < params.length; i++) {
      int eq = params[i].indexOf('=');
      if (eq > 0 && params[i].substring(0, eq).equalsIgnoreCase("password")) {
        params[i] = params[i].substring(0, eq + 1) + "****";
      }
    }
    return uri.substring(0, q + 1) + String.join("&", params);
  }
}
