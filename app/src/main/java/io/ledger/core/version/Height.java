package io.ledger.core.version;

/**
 * Logical commit point in the ledger's transaction order.
 * Both components are treated as unsigned when comparing.
 */
public record Height(long blockNum, long txNum) implements Comparable<Height> {

    public static final Height ZERO = new Height(0, 0);

    public static Height of(long blockNum, long txNum) {
        return new Height(blockNum, txNum);
    }

    @Override
    public int compareTo(Height other) {
        int cmp = Long.compareUnsigned(blockNum, other.blockNum);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compareUnsigned(txNum, other.txNum);
    }

    @Override
    public String toString() {
        return "Height{" + Long.toUnsignedString(blockNum) + ":" + Long.toUnsignedString(txNum) + "}";
    }
}
