package io.intellixity.pgconnect.jdbc;

import io.intellixity.pgconnect.exec.ConnectionTarget;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Converts libpq-style connection URIs ({@code postgresql://user:pw@host:port/db?opts}, including
 * host lists such as {@code h1:5432,h2:5433}) into {@code jdbc:postgresql:} URLs. Credentials move from the URI into driver properties; credentials
 * set explicitly on the {@link ConnectionTarget} win.
 */
public final class PostgresUris {
  private static final String JDBC_PREFIX = "jdbc:postgresql:";

  private PostgresUris() {}

  public static JdbcTarget toJdbc(ConnectionTarget target) {
    String raw = target.uri().trim();
    Properties props = new Properties();
    String url;

    if (raw.startsWith("jdbc:")) {
      url = raw;
    } else if (raw.startsWith("postgresql://") || raw.startsWith("postgres://")) {
      URI uri;
      try {
        uri = new URI(raw);
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Malformed connection uri: " + target.describe(), e);
      }
      // Raw authority: java.net.URI leaves getHost() null for underscore names and host lists.
      String authority = (uri.getRawAuthority() == null) ? "" : uri.getRawAuthority();
      int at = authority.lastIndexOf('@');
      String userInfo = (at < 0) ? "" : authority.substring(0, at);
      String hosts = authority.substring(at + 1);
      if (!userInfo.isEmpty()) {
        int colon = userInfo.indexOf(':');
        String user = (colon < 0) ? userInfo : userInfo.substring(0, colon);
        if (!user.isEmpty()) props.setProperty("user", decode(user));
        if (colon >= 0) props.setProperty("password", decode(userInfo.substring(colon + 1)));
      }
      StringBuilder sb = new StringBuilder(JDBC_PREFIX).append("//").append(hosts.isEmpty() ? "localhost" : hosts);
      String path = uri.getRawPath();
      sb.append((path == null || path.isEmpty()) ? "/" : path);
      if (uri.getRawQuery() != null) sb.append('?').append(uri.getRawQuery());
      url = sb.toString();
    } else {
      throw new IllegalArgumentException("Unsupported connection uri scheme: " + target.describe());
    }

    if (target.user() != null) props.setProperty("user", target.user());
    if (target.password() != null) props.setProperty("password", target.password());
    return new JdbcTarget(url, props);
  }

  /** Percent-decoding only; {@code +} is a literal in userinfo. */
  private static String decode(String s) {
    return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
  }
}
