package io.intellixity.pgconnect.row;

import java.util.*;

/**
 * Ordered, immutable column-to-value mapping.\n
 *
 * Column order is the order in which columns were added and decides the positional parameter
 * order of generated SQL. Column names are unique; {@link #with(String, Object)} replaces an
 * existing column in place.\n
 */
public final class Row implements Iterable<ColumnValue> {
  private static final Row EMPTY = new Row(List.of());

  private final List<ColumnValue> columns;

  private Row(List<ColumnValue> columns) {
    this.columns = columns;
  }

  public static Row empty() { return EMPTY; }

  public static Row of(String c1, Object v1) {
    return builder().put(c1, v1).build();
  }

  public static Row of(String c1, Object v1, String c2, Object v2) {
    return builder().put(c1, v1).put(c2, v2).build();
  }

  public static Row of(String c1, Object v1, String c2, Object v2, String c3, Object v3) {
    return builder().put(c1, v1).put(c2, v2).put(c3, v3).build();
  }

  /** Copies a map in its iteration order (use a {@link LinkedHashMap} to keep a stable order). */
  public static Row fromMap(Map<String, ?> map) {
    Objects.requireNonNull(map, "map");
    Builder b = builder();
    for (var e : map.entrySet()) b.put(e.getKey(), e.getValue());
    return b.build();
  }

  public static Builder builder() { return new Builder(); }

  public boolean isEmpty() { return columns.isEmpty(); }
  public int size() { return columns.size(); }

  public boolean contains(String column) {
    return indexOf(column) >= 0;
  }

  /** Value for the column, or null if the column is absent or holds null. */
  public Object get(String column) {
    int i = indexOf(column);
    return i < 0 ? null : columns.get(i).value();
  }

  public List<String> columns() {
    List<String> out = new ArrayList<>(columns.size());
    for (ColumnValue cv : columns) out.add(cv.column());
    return Collections.unmodifiableList(out);
  }

  /** Values in column order; may contain nulls. */
  public List<Object> values() {
    List<Object> out = new ArrayList<>(columns.size());
    for (ColumnValue cv : columns) out.add(cv.value());
    return Collections.unmodifiableList(out);
  }

  public Row with(String column, Object value) {
    return toBuilder().put(column, value).build();
  }

  /** Returns this row overlaid with {@code other}: shared columns take other's value, new ones are appended. */
  public Row mergedWith(Row other) {
    if (other == null || other.isEmpty()) return this;
    Builder b = toBuilder();
    for (ColumnValue cv : other) b.put(cv.column(), cv.value());
    return b.build();
  }

  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (ColumnValue cv : columns) out.put(cv.column(), cv.value());
    return Collections.unmodifiableMap(out);
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    for (ColumnValue cv : columns) b.put(cv.column(), cv.value());
    return b;
  }

  @Override
  public Iterator<ColumnValue> iterator() {
    return columns.iterator();
  }

  private int indexOf(String column) {
    if (column == null) return -1;
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).column().equals(column)) return i;
    }
    return -1;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Row r && columns.equals(r.columns);
  }

  @Override
  public int hashCode() { return columns.hashCode(); }

  @Override
  public String toString() {
    return "Row" + toMap();
  }

  public static final class Builder {
    private final List<ColumnValue> columns = new ArrayList<>();

    private Builder() {}

    public Builder put(String column, Object value) {
      ColumnValue cv = new ColumnValue(column, value);
      for (int i = 0; i < columns.size(); i++) {
        if (columns.get(i).column().equals(column)) {
          columns.set(i, cv);
          return this;
        }
      }
      columns.add(cv);
      return this;
    }

    public Row build() {
      return columns.isEmpty() ? EMPTY : new Row(List.copyOf(columns));
    }
  }
}
