package dupliganger.sam;

/**
 * The strand an alignment lies on, as derived from the 0x10 bit of its SAM flag.
 */
public enum Strand {
    FORWARD('+'),
    REVERSE('-');

    private final char symbol;

    Strand(final char symbol) {
        this.symbol = symbol;
    }

    /** @return '+' or '-' */
    public char getSymbol() {
        return symbol;
    }

    public static Strand fromFlag(final int flag) {
        return (flag & Read.READ_REVERSE_STRAND_FLAG) != 0 ? REVERSE : FORWARD;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
