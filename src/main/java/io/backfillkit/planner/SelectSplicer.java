package io.backfillkit.planner;

import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds where a window predicate can be spliced into a view's own SELECT: right after its
 * top-level WHERE keyword, or at the end of its top-level FROM clause when it has no WHERE.
 *
 * <p>Only depth-0 tokens count; anything inside parentheses, string literals, quoted identifiers
 * or comments is skipped, so subqueries and CTE bodies are left untouched.
 */
final class SelectSplicer {
    private static final Set<String> CLAUSE_AFTER_WHERE = Set.of(
            "GROUP", "HAVING", "ORDER", "LIMIT", "WINDOW", "QUALIFY", "SETTINGS", "FORMAT"
    );
    private static final Set<String> NEEDS_BY = Set.of("GROUP", "ORDER");
    // Clauses whose body may open with a parenthesis right after the keyword.
    private static final Set<String> PARENTHESIZED_CLAUSES = Set.of("HAVING", "QUALIFY");
    // A neighbour from this set makes the word an operand, not a keyword.
    private static final String OPERATOR_CHARS = "=<>!,.+%";
    private static final Map<String, Pattern> CLAUSE_SHAPES = Map.of(
            "WINDOW", Pattern.compile("(?is)WINDOW\\s+[A-Za-z_][A-Za-z0-9_]*\\s+AS\\s*\\("),
            "SETTINGS", Pattern.compile("(?is)SETTINGS\\s+[A-Za-z_][A-Za-z0-9_]*\\s*=(?!=)"),
            "FORMAT", Pattern.compile("(?is)FORMAT\\s+[A-Za-z_][A-Za-z0-9_]*\\s*\\z")
    );

    private SelectSplicer() {
    }

    static SplicePoint locate(String rawSelect) {
        String sql = stripTerminator(rawSelect);
        if (sql.isEmpty()) {
            throw unsupported("view query is empty");
        }
        List<Word> words = topLevelWords(sql);

        int selectAt = indexOf(words, "SELECT", 0);
        if (selectAt < 0) {
            throw unsupported("no top-level SELECT");
        }
        for (int i = selectAt; i < words.size(); i++) {
            Word word = words.get(i);
            String text = word.upper();
            boolean setOperator = (text.equals("UNION") || text.equals("INTERSECT")) && usedAsKeyword(sql, word);
            if (setOperator || isSetExcept(sql, words, i)) {
                throw unsupported("set operations (" + text + ") are not supported");
            }
            if ((text.equals("SETTINGS") || text.equals("FORMAT")) && usedAsKeyword(sql, word)) {
                throw unsupported("a top-level " + text + " clause is not supported");
            }
        }
        int fromAt = indexOf(words, "FROM", selectAt + 1);
        if (fromAt < 0) {
            throw unsupported("no top-level FROM");
        }

        int whereAt = -1;
        int clauseAt = -1;
        for (int i = fromAt + 1; i < words.size(); i++) {
            Word word = words.get(i);
            if (whereAt < 0 && word.upper().equals("WHERE")) {
                whereAt = i;
                continue;
            }
            if (isClauseStart(sql, words, i)) {
                clauseAt = i;
                break;
            }
        }
        int tailStart = clauseAt < 0 ? sql.length() : words.get(clauseAt).start();
        if (whereAt < 0) {
            return new SplicePoint(sql.substring(0, tailStart), null, sql.substring(tailStart));
        }
        int whereEnd = words.get(whereAt).end();
        return new SplicePoint(
                sql.substring(0, whereEnd),
                sql.substring(whereEnd, tailStart),
                sql.substring(tailStart)
        );
    }

    /**
     * Leftmost table read by the top-level FROM, when it is a plain {@code db.table} or {@code table}.
     */
    static String sourceTable(String rawSelect) {
        String sql = stripTerminator(rawSelect);
        List<Word> words = topLevelWords(sql);
        int selectAt = indexOf(words, "SELECT", 0);
        int fromAt = selectAt < 0 ? -1 : indexOf(words, "FROM", selectAt + 1);
        if (fromAt < 0) {
            return null;
        }
        int i = words.get(fromAt).end();
        while (i < sql.length() && Character.isWhitespace(sql.charAt(i))) {
            i++;
        }
        int start = i;
        while (i < sql.length() && (isWordChar(sql.charAt(i)) || sql.charAt(i) == '.')) {
            i++;
        }
        String name = sql.substring(start, i);
        return name.isEmpty() ? null : name;
    }

    private static boolean isClauseStart(String sql, List<Word> words, int i) {
        Word word = words.get(i);
        String text = word.upper();
        if (!CLAUSE_AFTER_WHERE.contains(text) || !usedAsKeyword(sql, word)) {
            return false;
        }
        if (NEEDS_BY.contains(text)) {
            return i + 1 < words.size() && words.get(i + 1).upper().equals("BY");
        }
        return true;
    }

    /**
     * False when the word is a function name ({@code format(...)}) or an operand such as a column
     * called {@code window} in {@code window = 1}.
     */
    private static boolean usedAsKeyword(String sql, Word word) {
        if (!PARENTHESIZED_CLAUSES.contains(word.upper())
                && word.end() < sql.length() && sql.charAt(word.end()) == '(') {
            return false;
        }
        if (isOperator(nextNonSpace(sql, word.end())) || isOperator(previousNonSpace(sql, word.start()))) {
            return false;
        }
        Pattern shape = CLAUSE_SHAPES.get(word.upper());
        return shape == null || shape.matcher(sql).region(word.start(), sql.length()).lookingAt();
    }

    private static boolean isOperator(char ch) {
        return ch != 0 && OPERATOR_CHARS.indexOf(ch) >= 0;
    }

    private static char nextNonSpace(String sql, int from) {
        for (int i = from; i < sql.length(); i++) {
            if (!Character.isWhitespace(sql.charAt(i))) {
                return sql.charAt(i);
            }
        }
        return 0;
    }

    private static char previousNonSpace(String sql, int before) {
        for (int i = before - 1; i >= 0; i--) {
            if (!Character.isWhitespace(sql.charAt(i))) {
                return sql.charAt(i);
            }
        }
        return 0;
    }

    // SELECT * EXCEPT (col) is a column transformer, not a set operation.
    private static boolean isSetExcept(String sql, List<Word> words, int i) {
        if (!words.get(i).upper().equals("EXCEPT")) {
            return false;
        }
        int j = words.get(i).end();
        while (j < sql.length() && Character.isWhitespace(sql.charAt(j))) {
            j++;
        }
        String rest = sql.substring(j).toUpperCase(Locale.ROOT);
        return rest.startsWith("SELECT") || rest.startsWith("ALL") || rest.startsWith("DISTINCT");
    }

    private static int indexOf(List<Word> words, String upper, int fromIndex) {
        for (int i = Math.max(0, fromIndex); i < words.size(); i++) {
            if (words.get(i).upper().equals(upper)) {
                return i;
            }
        }
        return -1;
    }

    static List<Word> topLevelWords(String sql) {
        List<Word> out = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char ch = sql.charAt(i);
            if (ch == '\'' || ch == '"' || ch == '`') {
                i = skipQuoted(sql, i, ch);
                continue;
            }
            if (ch == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (ch == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                continue;
            }
            if (ch == '(' || ch == '[') {
                depth++;
                i++;
                continue;
            }
            if (ch == ')' || ch == ']') {
                depth = Math.max(0, depth - 1);
                i++;
                continue;
            }
            if (isWordChar(ch)) {
                int start = i;
                while (i < n && isWordChar(sql.charAt(i))) {
                    i++;
                }
                if (depth == 0) {
                    out.add(new Word(sql.substring(start, i).toUpperCase(Locale.ROOT), start, i));
                }
                continue;
            }
            i++;
        }
        return out;
    }

    private static int skipQuoted(String sql, int openAt, char quote) {
        int i = openAt + 1;
        while (i < sql.length()) {
            char ch = sql.charAt(i);
            if (ch == '\\') {
                i += 2;
                continue;
            }
            if (ch == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static String stripTerminator(String raw) {
        String value = raw == null ? "" : raw.strip();
        while (value.endsWith(";")) {
            value = value.substring(0, value.length() - 1).strip();
        }
        return value;
    }

    private static BackfillConfigException unsupported(String reason) {
        return new BackfillConfigException(ErrorKind.UNSUPPORTED_VIEW_QUERY,
                "Cannot splice a window predicate into the view query: " + reason + ".");
    }

    record Word(String upper, int start, int end) {
    }

    /**
     * {@code head + predicate [+ AND (condition)] + tail}. {@code condition} is null when the view
     * has no top-level WHERE; {@code head} then ends at the close of the FROM clause.
     */
    record SplicePoint(String head, String condition, String tail) {
    }
}
