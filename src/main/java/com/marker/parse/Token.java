package com.marker.parse;

/**
 * A token in marker text.
 *
 * @param type     Token type
 * @param text     Source text; for strings, the content without quotes
 * @param position 0-based offset in the input
 */
public record Token(TokenType type, String text, int position) {

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
