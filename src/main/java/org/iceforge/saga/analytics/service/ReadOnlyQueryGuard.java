package org.iceforge.saga.analytics.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Gate for model-generated SQL. Accepts a single SELECT statement and returns it with markdown
 * fences, {@code --} comment lines and trailing semicolons removed.
 */
@Component
public class ReadOnlyQueryGuard {

    public static final String NO_SQL = "No SQL provided";
    public static final String NOT_READ_ONLY = "Only read-only queries allowed";
    public static final String MULTIPLE_STATEMENTS = "Multiple statements are not allowed";

    private static final Pattern FENCE_START = Pattern.compile("(?i)^```(?:sql)?\\s*");
    private static final Pattern FENCE_END = Pattern.compile("```\\s*$");
    private static final Pattern LINE_COMMENT = Pattern.compile("(?m)^\\s*--.*$\\R?");
    private static final Pattern LEADING_WORD = Pattern.compile("^([A-Za-z]+)");

    public String check(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new QueryRejectedException(NO_SQL);
        }

        String s = FENCE_START.matcher(sql.trim()).replaceFirst("");
        s = FENCE_END.matcher(s).replaceFirst("");
        s = LINE_COMMENT.matcher(s).replaceAll("").trim();
        if (s.isEmpty()) {
            throw new QueryRejectedException(NO_SQL);
        }

        var m = LEADING_WORD.matcher(s);
        if (!m.find() || !m.group(1).toUpperCase(Locale.ROOT).equals("SELECT")) {
            throw new QueryRejectedException(NOT_READ_ONLY);
        }

        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        if (s.indexOf(';') >= 0) {
            throw new QueryRejectedException(MULTIPLE_STATEMENTS);
        }
        return s;
    }
}
