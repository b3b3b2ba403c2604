package org.pragmatica.dfmt.chunk;

import java.util.regex.Pattern;

/**
 * Counts user-perceived characters: a base character followed by combining marks, or a
 * surrogate pair, counts once.
 */
final class Graphemes {
    private static final Pattern GRAPHEME = Pattern.compile("\\X");

    private Graphemes() {}

    static int length(String text) {
        var matcher = GRAPHEME.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++ ;
        }
        return count;
    }
}
