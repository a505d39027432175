package org.scssonjava.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

/**
 * Character classes used by the stylesheet scanner.
 * <p>
 * Characters are passed as {@code int} so that the end-of-input marker
 * {@link SourceScanner#EOF} can flow through without special casing.
 */
public final class CharacterUtil {

    private CharacterUtil() {
    }

    public static boolean isWhitespace(int c) {
        return c == ' ' || c == '\t' || isNewline(c);
    }

    /**
     * Line feed, carriage return and form feed all terminate a line in CSS.
     */
    public static boolean isNewline(int c) {
        return c == '\n' || c == '\r' || c == '\f';
    }

    public static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isAlphabetic(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Returns true if {@code c} can start an identifier.
     * CSS accepts any non-ASCII code point in a name; the only exception made here
     * is Unicode pattern whitespace (for example U+2028), which ICU reports.
     */
    public static boolean isNameStart(int c) {
        if (c < 0) {
            return false;
        }
        if (c < 0x80) {
            return c == '_' || isAlphabetic(c);
        }
        return !UCharacter.hasBinaryProperty(c, UProperty.PATTERN_WHITE_SPACE);
    }

    public static boolean isName(int c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }

    /**
     * Folds ASCII letters to lower case; every other character is returned unchanged.
     */
    public static int asciiToLower(int c) {
        return (c >= 'A' && c <= 'Z') ? c + ('a' - 'A') : c;
    }

    /**
     * Returns the closing bracket for an opening one, or -1.
     */
    public static int closingBracket(int c) {
        switch (c) {
            case '(':
                return ')';
            case '[':
                return ']';
            case '{':
                return '}';
            default:
                return -1;
        }
    }
}
