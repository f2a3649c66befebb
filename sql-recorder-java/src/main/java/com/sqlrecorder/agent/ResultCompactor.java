package com.sqlrecorder.agent;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Compacts query results into a column list plus positional rows for display.
 */
public final class ResultCompactor {

    private ResultCompactor() {}

    public static class CompactResult {
        @SerializedName("keys")   public List<String> keys;
        @SerializedName("values") public List<List<Object>> values;

        CompactResult(List<String> keys, List<List<Object>> values) {
            this.keys = keys;
            this.values = values;
        }
    }

    /**
     * Rows that are maps are laid out along the first row's keys. Positional rows
     * ({@code List} or {@code Object[]}) are kept as they are, with {@code columns} as keys,
     * typically the executor's {@link QueryExecutor#lastColumnNames()}. A positional row
     * mixed into map rows is kept as it is.
     */
    public static CompactResult compact(List<?> rows, List<String> columns) {
        if (rows == null || rows.isEmpty()) {
            return new CompactResult(new ArrayList<>(), new ArrayList<>());
        }
        List<List<Object>> values = new ArrayList<>();
        if (rows.get(0) instanceof Map<?, ?> firstRow) {
            List<Object> keyObjects = new ArrayList<>(firstRow.keySet());
            List<String> keys = new ArrayList<>(keyObjects.size());
            for (Object key : keyObjects) keys.add(String.valueOf(key));
            for (Object row : rows) {
                if (row instanceof Map<?, ?> map) {
                    List<Object> line = new ArrayList<>(keyObjects.size());
                    for (Object key : keyObjects) line.add(map.get(key));
                    values.add(line);
                } else {
                    values.add(positional(row));
                }
            }
            return new CompactResult(keys, values);
        }
        for (Object row : rows) {
            values.add(positional(row));
        }
        return new CompactResult(new ArrayList<>(columns == null ? List.of() : columns), values);
    }

    private static List<Object> positional(Object row) {
        if (row instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        if (row instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        List<Object> single = new ArrayList<>();
        single.add(row);
        return single;
    }
}
