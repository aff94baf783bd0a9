package com.connection.pool.driver;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A row of column values, addressed by zero-based index.
 *
 * <p>Rows are mutable so that {@link DriverResult#scanRow(Row)} can refill
 * the same instance while streaming.</p>
 */
public final class Row {

    private final List<Object> values;

    public Row() {
        this.values = new ArrayList<>();
    }

    public Row(List<?> values) {
        this.values = new ArrayList<>(values);
    }

    public static Row of(Object... values) {
        return new Row(Arrays.asList(values));
    }

    /**
     * Replaces every value of this row.
     */
    public void setValues(List<?> newValues) {
        values.clear();
        values.addAll(newValues);
    }

    public List<Object> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return values.size();
    }

    public Object get(int column) {
        return values.get(column);
    }

    public boolean isNull(int column) {
        return values.get(column) == null;
    }

    public String getString(int column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    public long getLong(int column) {
        Object value = values.get(column);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(getString(column).trim());
    }

    public int getInt(int column) {
        return Math.toIntExact(getLong(column));
    }

    public boolean getBoolean(int column) {
        Object value = values.get(column);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return getLong(column) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
