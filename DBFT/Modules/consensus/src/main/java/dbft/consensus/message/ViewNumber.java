package dbft.consensus.message;

public record ViewNumber(int value) implements Comparable<ViewNumber> {
    public static final ViewNumber ZERO = new ViewNumber(0);

    public ViewNumber {
        if (value < 0) throw new IllegalArgumentException("view must be non-negative: " + value);
    }

    public static ViewNumber of(int value) { return value == 0 ? ZERO : new ViewNumber(value); }

    public ViewNumber next() { return new ViewNumber(Math.addExact(value, 1)); }

    public boolean isBefore(ViewNumber other) { return value < other.value; }

    public boolean isAfter(ViewNumber other) { return value > other.value; }

    @Override public int compareTo(ViewNumber o) { return Integer.compare(value, o.value); }

    @Override public String toString() { return Integer.toString(value); }
}
