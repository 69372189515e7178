package com.depgraph.engine.scan;

/**
 * Blanks comments and string contents line by line while preserving columns, so that pattern
 * matching never sees code-like text inside literals. Block comments, triple-quoted strings and
 * multi-line raw strings carry over to the following lines.
 */
final class LineMasker {

    /** {@code code} has comments and string contents blanked; {@code text} only comments. */
    record MaskedLine(String code, String text) {}

    private final String lineComment;
    private final boolean blockComments;
    private final boolean tripleQuotes;
    private final String quotes;
    private final String multilineQuotes;
    private final boolean rustCharLiterals;

    // Terminator of a construct opened on an earlier line, or null.
    private String open;

    LineMasker(String lineComment, boolean blockComments, boolean tripleQuotes,
               String quotes, String multilineQuotes, boolean rustCharLiterals) {
        this.lineComment = lineComment;
        this.blockComments = blockComments;
        this.tripleQuotes = tripleQuotes;
        this.quotes = quotes;
        this.multilineQuotes = multilineQuotes;
        this.rustCharLiterals = rustCharLiterals;
    }

    /** Construct still open after the last masked line, e.g. {@code "*}{@code /"}; null when balanced. */
    String unterminated() {
        return open;
    }

    MaskedLine mask(String line) {
        char[] code = line.toCharArray();
        char[] text = line.toCharArray();
        int n = line.length();
        int i = 0;
        while (i < n) {
            if (open != null) {
                boolean comment = open.equals("*/");
                int end = findClose(line, i, open, !comment);
                int stop = end < 0 ? n : end;
                blank(code, i, stop);
                if (comment) blank(text, i, stop);
                if (end < 0) break;
                if (comment) {
                    blank(code, end, end + 2);
                    blank(text, end, end + 2);
                }
                i = end + open.length();
                open = null;
                continue;
            }

            char c = line.charAt(i);
            if (lineComment != null && line.startsWith(lineComment, i)) {
                blank(code, i, n);
                blank(text, i, n);
                break;
            }
            if (blockComments && line.startsWith("/*", i)) {
                blank(code, i, i + 2);
                blank(text, i, i + 2);
                open = "*/";
                i += 2;
            } else if (tripleQuotes && (line.startsWith("\"\"\"", i) || line.startsWith("'''", i))) {
                open = line.substring(i, i + 3);
                i += 3;
            } else if (multilineQuotes.indexOf(c) >= 0) {
                open = String.valueOf(c);
                i++;
            } else if (c == '\'' && rustCharLiterals) {
                int end = rustCharEnd(line, i);
                if (end < 0) {
                    // lifetime, not a literal
                    i++;
                } else {
                    blank(code, i + 1, end);
                    i = end + 1;
                }
            } else if (quotes.indexOf(c) >= 0) {
                int end = findClose(line, i + 1, String.valueOf(c), true);
                int stop = end < 0 ? n : end;
                blank(code, i + 1, stop);
                i = end < 0 ? n : end + 1;
            } else {
                i++;
            }
        }
        return new MaskedLine(new String(code), new String(text));
    }

    private static int findClose(String line, int from, String terminator, boolean escapes) {
        int i = from;
        while (i < line.length()) {
            if (escapes && line.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (line.startsWith(terminator, i)) return i;
            i++;
        }
        return -1;
    }

    private static int rustCharEnd(String line, int start) {
        if (start + 1 < line.length() && line.charAt(start + 1) == '\\') {
            return line.indexOf('\'', start + 2);
        }
        if (start + 2 < line.length() && line.charAt(start + 2) == '\'') {
            return start + 2;
        }
        return -1;
    }

    private static void blank(char[] chars, int from, int to) {
        for (int i = Math.max(0, from); i < Math.min(chars.length, to); i++) {
            chars[i] = ' ';
        }
    }
}
