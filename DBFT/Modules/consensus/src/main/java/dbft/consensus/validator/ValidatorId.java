package dbft.consensus.validator;

/** Index of a validator in the roster of the current configuration epoch (unsigned 16-bit). */
public record ValidatorId(int value) implements Comparable<ValidatorId> {
    public static final int MAX = 0xFFFF;

    public ValidatorId {
        if (value < 0 || value > MAX) throw new IllegalArgumentException("validator id out of range: " + value);
    }

    public static ValidatorId of(int value) { return new ValidatorId(value); }

    @Override public int compareTo(ValidatorId o) { return Integer.compare(value, o.value); }

    @Override public String toString() { return "v" + value; }
}
