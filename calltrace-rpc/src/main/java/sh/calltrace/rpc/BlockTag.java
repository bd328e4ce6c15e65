// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import java.util.Locale;

import sh.calltrace.primitives.Hex;

/**
 * Identifies the block whose transactions are listed.
 * <p>
 * A tag is either a named block ({@code "latest"}, {@code "earliest"}) or a
 * block number.
 *
 * <pre>{@code
 * BlockTag latest = BlockTag.LATEST;
 * BlockTag block = BlockTag.of(26L);
 * BlockTag parsed = BlockTag.parse("0x1a");   // equals block
 * String rpcValue = block.toRpcValue();        // "0x1a"
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface BlockTag permits BlockTag.Named, BlockTag.Number {

    /** The most recent block. */
    BlockTag LATEST = new Named("latest");

    /** The genesis block. */
    BlockTag EARLIEST = new Named("earliest");

    /**
     * Creates a block tag for a specific block number.
     *
     * @param blockNumber the block number
     * @return a BlockTag representing the specific block
     */
    static BlockTag of(long blockNumber) {
        return new Number(blockNumber);
    }

    /**
     * Parses the JSON-RPC string form of a block tag.
     *
     * @param value {@code "latest"}, {@code "earliest"} or a hex block number
     * @return the parsed tag
     * @throws IllegalArgumentException if the value is neither
     */
    static BlockTag parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Block tag cannot be null or blank");
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (Hex.hasPrefix(normalized)) {
            return of(Hex.decodeQuantity(normalized));
        }
        return new Named(normalized);
    }

    /**
     * Converts this block tag to its RPC string representation.
     *
     * @return the name for named tags, a hex quantity for block numbers
     */
    String toRpcValue();

    /**
     * Named block tag, {@code "latest"} or {@code "earliest"}.
     */
    record Named(String name) implements BlockTag {
        public Named {
            if (!"latest".equals(name) && !"earliest".equals(name)) {
                throw new IllegalArgumentException("Unsupported block tag: " + name);
            }
        }

        @Override
        public String toRpcValue() {
            return name;
        }
    }

    /**
     * Block number tag.
     */
    record Number(long blockNumber) implements BlockTag {
        public Number {
            if (blockNumber < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + blockNumber);
            }
        }

        @Override
        public String toRpcValue() {
            return Hex.encodeQuantity(blockNumber);
        }
    }
}
