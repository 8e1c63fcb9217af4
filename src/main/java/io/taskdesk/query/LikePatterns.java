package io.taskdesk.query;

final class LikePatterns {
    static final char ESCAPE_CHAR = '\\';

    private LikePatterns() {
    }

    /**
     * Builds a {@code LIKE} pattern matching {@code term} as a literal substring.
     */
    static String contains(String term) {
        return "%" + escape(term) + "%";
    }

    static String escape(String term) {
        if (term == null || term.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(term.length() + 8);
        for (int i = 0; i < term.length(); i++) {
            char ch = term.charAt(i);
            if (ch == ESCAPE_CHAR || ch == '%' || ch == '_') {
                sb.append(ESCAPE_CHAR);
            }
            sb.append(ch);
        }
        return sb.toString();
    }
}
