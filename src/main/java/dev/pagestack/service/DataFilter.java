package dev.pagestack.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row filter written in a section's data declaration, e.g.
 * {@code status = 'open' AND priority >= 2}.
 * <p>
 * Conditions are joined with {@code AND} (an {@code AND} inside a quoted value is part of the
 * value); a leading {@code WHERE} or {@code AND} is ignored.
 * Values compare numerically when both sides are numbers and as strings otherwise.
 */
public final class DataFilter implements Predicate<Map<String, Object>> {

    private static final Pattern LEADING_KEYWORD = Pattern.compile("^(?i)(WHERE|AND)\\s+");
    private static final Pattern AND = Pattern.compile("\\s+(?i)AND\\s+");
    private static final Pattern CONDITION = Pattern.compile(
            "^\\s*([A-Za-z_][A-Za-z0-9_.]*)\\s*(>=|<=|!=|<>|=|>|<)\\s*(.*?)\\s*$");

    private static final DataFilter MATCH_ALL = new DataFilter(List.of());

    private final List<Condition> conditions;

    private DataFilter(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /**
     * @throws IllegalArgumentException when a condition cannot be parsed
     */
    public static DataFilter parse(String filter) {
        if (filter == null || filter.isBlank()) {
            return MATCH_ALL;
        }
        String body = LEADING_KEYWORD.matcher(filter.trim()).replaceFirst("");
        List<Condition> conditions = new ArrayList<>();
        for (String part : splitConditions(body)) {
            Matcher matcher = CONDITION.matcher(part);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Unsupported filter condition: '" + part.trim() + "'");
            }
            conditions.add(new Condition(matcher.group(1), matcher.group(2), unquote(matcher.group(3))));
        }
        return new DataFilter(List.copyOf(conditions));
    }

    private static List<String> splitConditions(String body) {
        List<String> parts = new ArrayList<>();
        Matcher separator = AND.matcher(body);
        int start = 0;
        while (separator.find()) {
            if (!insideQuotes(body, separator.start())) {
                parts.add(body.substring(start, separator.start()));
                start = separator.end();
            }
        }
        parts.add(body.substring(start));
        return parts;
    }

    private static boolean insideQuotes(String text, int end) {
        char open = 0;
        for (int i = 0; i < end; i++) {
            char c = text.charAt(i);
            if (open == 0) {
                if (c == '\'' || c == '"') {
                    open = c;
                }
            } else if (c == open) {
                open = 0;
            }
        }
        return open != 0;
    }

    @Override
    public boolean test(Map<String, Object> row) {
        for (Condition condition : conditions) {
            if (!condition.matches(row)) {
                return false;
            }
        }
        return true;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        if ("null".equals(value.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return value;
    }

    private record Condition(String field, String operator, String value) {

        boolean matches(Map<String, Object> row) {
            Object actual = row.get(field);
            if (actual == null || value == null) {
                boolean bothNull = actual == null && value == null;
                return switch (operator) {
                    case "=" -> bothNull;
                    case "!=", "<>" -> !bothNull;
                    default -> false;
                };
            }
            int comparison = compare(String.valueOf(actual), value);
            return switch (operator) {
                case "=" -> comparison == 0;
                case "!=", "<>" -> comparison != 0;
                case ">" -> comparison > 0;
                case "<" -> comparison < 0;
                case ">=" -> comparison >= 0;
                case "<=" -> comparison <= 0;
                default -> throw new IllegalStateException("Unknown operator " + operator);
            };
        }

        private static int compare(String actual, String expected) {
            BigDecimal left = number(actual);
            BigDecimal right = number(expected);
            if (left != null && right != null) {
                return left.compareTo(right);
            }
            return Objects.compare(actual, expected, String::compareTo);
        }

        private static BigDecimal number(String value) {
            try {
                return new BigDecimal(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
