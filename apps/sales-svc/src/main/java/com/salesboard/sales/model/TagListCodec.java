package com.salesboard.sales.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and writes the brace-delimited list text used for the {@code tags} column, e.g.
 * {@code {electronics,"home goods"}}. Tokens are quoted under the same rules PostgreSQL uses
 * when printing a text array, so values exported from an array column decode unchanged.
 */
public final class TagListCodec {

    public static final char LIKE_ESCAPE = '\\';

    private static final String EMPTY_LIST = "{}";

    private TagListCodec() {
    }

    public static List<String> decode(String encoded) {
        if (encoded == null) {
            return List.of();
        }
        String body = encoded.trim();
        if (body.startsWith("{")) {
            body = body.substring(1);
        }
        if (body.endsWith("}")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return List.of();
        }

        List<String> tags = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean wasQuoted = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (inQuotes) {
                if (c == '\\' && i + 1 < body.length()) {
                    current.append(body.charAt(++i));
                } else if (c == '"') {
                    inQuotes = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
                wasQuoted = true;
            } else if (c == ',') {
                addToken(tags, current.toString(), wasQuoted);
                current.setLength(0);
                wasQuoted = false;
            } else if (Character.isWhitespace(c) && (wasQuoted || current.length() == 0)) {
                // padding around a token
                continue;
            } else {
                current.append(c);
            }
        }
        addToken(tags, current.toString(), wasQuoted);
        return List.copyOf(tags);
    }

    public static String encode(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return EMPTY_LIST;
        }
        StringBuilder out = new StringBuilder("{");
        for (int i = 0; i < tags.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(encodeToken(tags.get(i)));
        }
        return out.append('}').toString();
    }

    /**
     * Whether {@code encoded} is exactly the text {@link #encode} writes for its decoded tags.
     * Only canonical text is guaranteed to match {@link #elementPatterns}; padded or
     * brace-less lists decode to the same tags but need matching by value.
     */
    public static boolean isCanonical(String encoded) {
        return encoded != null && encode(decode(encoded)).equals(encoded);
    }

    /**
     * {@code LIKE} patterns (escaped with {@link #LIKE_ESCAPE}) matching encoded text that holds
     * {@code tag} as a whole element. The token is anchored between list delimiters so that
     * {@code home} does not match a list containing only {@code home goods}.
     */
    public static List<String> elementPatterns(String tag) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(encodeToken(tag));
        forms.add(quote(tag));
        List<String> patterns = new ArrayList<>();
        for (String form : forms) {
            for (String before : List.of("{", ",")) {
                for (String after : List.of(",", "}")) {
                    patterns.add("%" + escapeLike(before + form + after) + "%");
                }
            }
        }
        return patterns;
    }

    static String encodeToken(String tag) {
        return needsQuoting(tag) ? quote(tag) : tag;
    }

    private static boolean needsQuoting(String tag) {
        if (tag.isEmpty() || tag.equalsIgnoreCase("NULL")) {
            return true;
        }
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (Character.isWhitespace(c) || c == ',' || c == '{' || c == '}' || c == '"' || c == '\\') {
                return true;
            }
        }
        return false;
    }

    private static String quote(String tag) {
        return "\"" + tag.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static String escapeLike(String value) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                out.append(LIKE_ESCAPE);
            }
            out.append(c);
        }
        return out.toString();
    }

    private static void addToken(List<String> tags, String raw, boolean quoted) {
        if (quoted) {
            tags.add(raw);
            return;
        }
        String token = raw.trim();
        // an unquoted NULL is a null element, not the text "NULL"
        if (!token.isEmpty() && !token.equalsIgnoreCase("NULL")) {
            tags.add(token);
        }
    }
}
