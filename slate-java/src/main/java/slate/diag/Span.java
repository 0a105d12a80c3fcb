package slate.diag;

/**
 * A half-open character range {@code [start, end)} in some source text, with the 1-based line and
 * column of {@code start}.
 */
public record Span(int start, int end, int line, int column) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Bad span [" + start + ", " + end + ")");
        }
    }

    /** Builds a span over {@code text}, computing line and column of {@code start}. */
    public static Span of(String text, int start, int end) {
        int line = 1;
        int col = 1;
        int limit = Math.min(start, text.length());
        for (int i = 0; i < limit; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                col = 1;
            } else {
                col++;
            }
        }
        return new Span(start, end, line, col);
    }

    public Span to(Span other) {
        return new Span(start, Math.max(end, other.end), line, column);
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end || (start == end && offset == start);
    }

    public int length() {
        return end - start;
    }

    /** Moves this span into a host text in which the fragment it belongs to starts at {@code base}. */
    public Span translate(String hostText, int base) {
        return of(hostText, start + base, end + base);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
