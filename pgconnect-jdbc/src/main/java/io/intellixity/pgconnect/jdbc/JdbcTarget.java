package io.intellixity.pgconnect.jdbc;

import io.intellixity.pgconnect.exec.ConnectionTarget;

import java.util.Objects;
import java.util.Properties;

/** JDBC URL plus driver properties ({@code user}, {@code password}) for {@link java.sql.DriverManager}. */
public record JdbcTarget(String url, Properties properties) {
  public JdbcTarget {
    Objects.requireNonNull(url, "url");
    Properties copy = new Properties();
    if (properties != null) copy.putAll(properties);
    properties = copy;
  }

  public String user() {
    return properties.getProperty("user");
  }

  @Override
  public String toString() {
    return "JdbcTarget[url=" + ConnectionTarget.redact(url) + ", user=" + user()
        + (properties.containsKey("password") ? ", password=****" : "") + "]";
  }
}
