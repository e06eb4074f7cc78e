package org.dxworks.formframe.serializer;

public final class HtmlEscaper {

    private HtmlEscaper() {
        // utility class
    }

    /** Escapes text for use both as element content and inside a double-quoted attribute. */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Escapes text content and turns line breaks into {@code <br>}. */
    public static String escapeMultiline(String text) {
        return escape(text).replace("\r\n", "\n").replace("\n", "<br>");
    }
}
