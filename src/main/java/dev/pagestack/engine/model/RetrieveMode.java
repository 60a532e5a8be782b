package dev.pagestack.engine.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * How retrieved rows are folded into the value stored under a data-source scope.
 */
public enum RetrieveMode {

    /** One row: the row itself. Several rows: every field joined with commas. */
    ALL("all") {
        @Override
        public Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration) {
            if (rows.isEmpty()) {
                return Map.of();
            }
            if (rows.size() == 1) {
                return project(rows.get(0), declaration);
            }
            Map<String, Object> joined = new LinkedHashMap<>();
            collectColumns(rows, declaration, false).forEach((name, values) -> joined.put(name, joinValues(values)));
            return joined;
        }
    },
    FIRST("first") {
        @Override
        public Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration) {
            return rows.isEmpty() ? Map.of() : project(rows.get(0), declaration);
        }
    },
    LAST("last") {
        @Override
        public Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration) {
            return rows.isEmpty() ? Map.of() : project(rows.get(rows.size() - 1), declaration);
        }
    },
    /** Every field becomes the list of its values across all rows. */
    ALL_AS_ARRAY("all_as_array") {
        @Override
        public Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration) {
            if (rows.isEmpty()) {
                return Map.of();
            }
            return new LinkedHashMap<String, Object>(collectColumns(rows, declaration, true));
        }
    },
    /** The list of rows, each renamed and projected. */
    JSON("JSON") {
        @Override
        public Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration) {
            List<Map<String, Object>> records = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Map<String, Object> record = new LinkedHashMap<>();
                for (DataSourceDeclaration.FieldRename rename : declaration.mapFields()) {
                    if (row.get(rename.fieldName()) != null) {
                        record.put(rename.newName(), row.get(rename.fieldName()));
                    }
                }
                if (declaration.fields().isEmpty()) {
                    row.forEach(record::putIfAbsent);
                } else {
                    declaration.fields().forEach(field -> record.put(field.holder(), field.valueOf(row)));
                }
                records.add(record);
            }
            return records;
        }
    };

    private final String wireName;

    RetrieveMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public abstract Object shape(List<Map<String, Object>> rows, DataSourceDeclaration declaration);

    /**
     * Unknown or missing modes fall back to {@link #ALL}.
     */
    public static RetrieveMode fromWireName(String value) {
        if (value != null) {
            for (RetrieveMode mode : values()) {
                if (mode.wireName.equalsIgnoreCase(value.trim())) {
                    return mode;
                }
            }
        }
        return ALL;
    }

    static Map<String, Object> project(Map<String, Object> row, DataSourceDeclaration declaration) {
        if (!declaration.projectsFields()) {
            return row;
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        declaration.fields().forEach(field -> projected.put(field.holder(), field.valueOf(row)));
        return projected;
    }

    static Map<String, List<Object>> collectColumns(List<Map<String, Object>> rows,
                                                    DataSourceDeclaration declaration,
                                                    boolean keepNulls) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        if (declaration.projectsFields()) {
            for (DataSourceDeclaration.FieldSelection field : declaration.fields()) {
                List<Object> values = new ArrayList<>(rows.size());
                rows.forEach(row -> values.add(field.valueOf(row)));
                columns.put(field.holder(), values);
            }
            return columns;
        }
        // first row is the template for the column set
        for (String name : rows.get(0).keySet()) {
            List<Object> values = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                Object value = row.get(name);
                values.add(value == null && !keepNulls ? "" : value);
            }
            columns.put(name, values);
        }
        return columns;
    }

    private static String joinValues(Collection<Object> values) {
        return values.stream()
                .map(value -> value == null ? "" : String.valueOf(value))
                .collect(Collectors.joining(","));
    }
}
