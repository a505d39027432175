package org.scssonjava.lexer;

import java.util.Objects;

/**
 * An immutable snapshot of a {@link SourceScanner} position.
 * <p>
 * A state can be restored with {@link SourceScanner#setState(ScannerState)} at any
 * time, as long as it was taken from the same scanner.
 */
public final class ScannerState {
    // Offset of the next character to be read
    public final int position;
    // Zero-based line of the next character
    public final int line;
    // Zero-based column of the next character
    public final int column;

    public ScannerState(int position, int line, int column) {
        this.position = position;
        this.line = line;
        this.column = column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScannerState)) return false;
        ScannerState that = (ScannerState) o;
        return position == that.position && line == that.line && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, line, column);
    }

    @Override
    public String toString() {
        return "ScannerState{" + "position=" + position + ", line=" + line + ", column=" + column + '}';
    }
}
