package io.ledger.core.statedb.couch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ledger.core.version.Height;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Body of the savepoint document. Field names are part of the persisted format.
 * {@code BlockNum} and {@code TxNum} are unsigned 64-bit numbers.
 * {@code UpdateSeq} is the store's change sequence right after the data writes were flushed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SavepointDocument(
        @JsonProperty("BlockNum") BigInteger blockNum,
        @JsonProperty("TxNum") BigInteger txNum,
        @JsonProperty("UpdateSeq") String updateSeq
) {
    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    SavepointDocument {
        requireUint64(blockNum, "BlockNum");
        requireUint64(txNum, "TxNum");
    }

    static SavepointDocument of(Height height, String updateSeq) {
        return new SavepointDocument(unsigned(height.blockNum()), unsigned(height.txNum()), updateSeq);
    }

    Height height() {
        return Height.of(blockNum.longValue(), txNum.longValue());
    }

    private static BigInteger unsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }

    private static void requireUint64(BigInteger value, String field) {
        Objects.requireNonNull(value, field);
        if (value.signum() < 0 || value.compareTo(UINT64_MAX) > 0) {
            throw new IllegalArgumentException(field + " out of uint64 range: " + value);
        }
    }
}
