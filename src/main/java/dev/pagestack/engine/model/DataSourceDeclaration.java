package dev.pagestack.engine.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * One entry of a section's {@code data_config}: which data table to read, how to filter and
 * shape the rows, and the scope name the result is published under.
 *
 * @param table       data table name
 * @param filter      filter expression handed to the retriever, may be blank
 * @param scope       namespace for the result; blank means the declaration's index
 * @param currentUser restrict rows to the requesting user's own entries
 * @param retrieve    folding of the rows into a single scope value
 * @param allFields   when false and {@code fields} is not empty, rows are projected onto {@code fields}
 * @param fields      projected fields with their output names and fallbacks
 * @param mapFields   renames applied in {@link RetrieveMode#JSON}
 */
public record DataSourceDeclaration(
        String table,
        String filter,
        String scope,
        boolean currentUser,
        RetrieveMode retrieve,
        boolean allFields,
        List<FieldSelection> fields,
        List<FieldRename> mapFields
) {

    public DataSourceDeclaration {
        filter = filter == null ? "" : filter;
        retrieve = retrieve == null ? RetrieveMode.ALL : retrieve;
        fields = fields == null ? List.of() : List.copyOf(fields);
        mapFields = mapFields == null ? List.of() : List.copyOf(mapFields);
    }

    public String scopeName(int index) {
        return scope == null || scope.isBlank() ? String.valueOf(index) : scope;
    }

    public boolean projectsFields() {
        return !allFields && !fields.isEmpty();
    }

    /**
     * Field names the retriever has to return; empty means every column.
     */
    public List<String> requestedFieldNames() {
        if (!projectsFields()) {
            return List.of();
        }
        return fields.stream().map(FieldSelection::fieldName).toList();
    }

    /**
     * Applies {@code substitution} to every string-valued part of the declaration.
     */
    public DataSourceDeclaration interpolate(UnaryOperator<String> substitution) {
        return new DataSourceDeclaration(
                apply(substitution, table),
                apply(substitution, filter),
                apply(substitution, scope),
                currentUser,
                retrieve,
                allFields,
                fields.stream()
                        .map(field -> new FieldSelection(
                                apply(substitution, field.fieldName()),
                                apply(substitution, field.fieldHolder()),
                                apply(substitution, field.notFoundText())))
                        .toList(),
                mapFields.stream()
                        .map(rename -> new FieldRename(
                                apply(substitution, rename.fieldName()),
                                apply(substitution, rename.newName())))
                        .toList());
    }

    private static String apply(UnaryOperator<String> substitution, String value) {
        return value == null ? null : substitution.apply(value);
    }

    public record FieldSelection(String fieldName, String fieldHolder, String notFoundText) {

        public String holder() {
            return fieldHolder == null || fieldHolder.isBlank() ? fieldName : fieldHolder;
        }

        /**
         * The row's value, or {@code notFoundText} when it is missing or empty.
         */
        public Object valueOf(Map<String, Object> row) {
            Object value = row.get(fieldName);
            if (isEmptyValue(value)) {
                return notFoundText == null ? "" : notFoundText;
            }
            return value;
        }

        private static boolean isEmptyValue(Object value) {
            if (value == null) {
                return true;
            }
            if (value instanceof CharSequence text) {
                return text.length() == 0;
            }
            if (value instanceof Collection<?> collection) {
                return collection.isEmpty();
            }
            return value instanceof Map<?, ?> map && map.isEmpty();
        }
    }

    public record FieldRename(String fieldName, String newName) {
    }
}
