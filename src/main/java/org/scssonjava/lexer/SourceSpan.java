package org.scssonjava.lexer;

/**
 * A contiguous range of source text, from a start state (inclusive) to an end
 * state (exclusive).
 * <p>
 * Spans carry the text they cover so that nodes and diagnostics can be rendered
 * without going back to the scanner.
 */
public final class SourceSpan {
    public final String url;
    public final ScannerState start;
    public final ScannerState end;
    public final String text;

    public SourceSpan(String url, ScannerState start, ScannerState end, String text) {
        this.url = url;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public int length() {
        return end.position - start.position;
    }

    /**
     * Returns a span covering both this span and {@code other}, which must come from
     * the same source and start at or after this span's start.
     *
     * @param other the span to extend to
     * @param source the full source text both spans were taken from
     * @return the combined span
     */
    public SourceSpan expand(SourceSpan other, String source) {
        ScannerState newEnd = other.end.position > end.position ? other.end : end;
        return new SourceSpan(url, start, newEnd, source.substring(start.position, newEnd.position));
    }

    /**
     * Human-readable location, for example {@code "style.scss 3:5"}. Lines and
     * columns are reported one-based.
     */
    public String location() {
        return (url == null ? "-" : url) + " " + (start.line + 1) + ":" + (start.column + 1);
    }

    @Override
    public String toString() {
        return "SourceSpan{" + location() + ", text='" + text + "'}";
    }
}
