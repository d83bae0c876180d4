package com.eavstore.core.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * SQL text with {@code :name} placeholders rewritten to positional {@code ?} markers.
 *
 * Placeholders inside single-quoted literals, double-quoted identifiers and
 * {@code --} / block comments are left alone, as is the {@code ::} cast operator.
 */
public record NamedParameters(String sql, List<String> names) {

    public NamedParameters {
        names = Collections.unmodifiableList(new ArrayList<>(names));
    }

    public static NamedParameters parse(String text) {
        StringBuilder out = new StringBuilder(text.length());
        List<String> names = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(text, i, c);
                out.append(text, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                int end = text.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(text, i, end);
                i = end;
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                out.append(text, i, end);
                i = end;
            } else if (c == ':' && i + 1 < n && text.charAt(i + 1) == ':') {
                out.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < n && Character.isJavaIdentifierStart(text.charAt(i + 1))) {
                int end = i + 1;
                while (end < n && Character.isJavaIdentifierPart(text.charAt(end))) {
                    end++;
                }
                names.add(text.substring(i + 1, end));
                out.append('?');
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return new NamedParameters(out.toString(), names);
    }

    // Doubled quote characters are escapes inside SQL literals
    private static int skipQuoted(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == quote) {
                if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    /**
     * Parameter values in positional order.
     *
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public List<Object> bind(Map<String, ?> params) {
        List<Object> values = new ArrayList<>(names.size());
        for (String name : names) {
            if (params == null || !params.containsKey(name)) {
                throw new IllegalArgumentException("No value for SQL parameter :" + name);
            }
            values.add(params.get(name));
        }
        return values;
    }
}
