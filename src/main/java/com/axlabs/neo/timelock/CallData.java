package com.axlabs.neo.timelock;

import io.neow3j.crypto.Hash;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds and reads call payloads.
 * <p>
 * A payload is a 4 byte function selector followed by the arguments. The selector is the first 4 bytes of the
 * SHA-256 hash of the function signature, e.g. {@code setDelay(uint256)}. Integers are encoded as 32 byte
 * unsigned big-endian words and hashes as their 20 big-endian bytes.
 */
public final class CallData {

    public static final int SELECTOR_LENGTH = 4;
    public static final int WORD_LENGTH = 32;
    public static final int HASH160_LENGTH = 20;

    private CallData() {
    }

    public static byte[] selector(String signature) {
        return Arrays.copyOf(Hash.sha256(signature.getBytes(UTF_8)), SELECTOR_LENGTH);
    }

    /**
     * Builds the payload for a call. Without a signature the payload is the raw data.
     *
     * @param signature The function signature. May be empty.
     * @param data      The encoded arguments.
     * @return the payload.
     */
    public static byte[] encode(String signature, byte[] data) {
        if (signature == null || signature.isEmpty()) {
            return data.clone();
        }
        return ByteBuffer.allocate(SELECTOR_LENGTH + data.length)
                .put(selector(signature))
                .put(data)
                .array();
    }

    public static byte[] encodeUint(BigInteger value) {
        FullMath.requireUint256(value);
        byte[] bytes = value.toByteArray();
        byte[] word = new byte[WORD_LENGTH];
        // toByteArray() may add a leading sign byte.
        int length = Math.min(bytes.length, WORD_LENGTH);
        System.arraycopy(bytes, bytes.length - length, word, WORD_LENGTH - length, length);
        return word;
    }

    public static byte[] encodeUint(long value) {
        return encodeUint(BigInteger.valueOf(value));
    }

    public static byte[] encodeHash160(Hash160 hash) {
        return hash.toArray();
    }

    public static BigInteger decodeUint(byte[] args, int offset) {
        if (args.length < offset + WORD_LENGTH) {
            throw new BoundsException("decodeUint", "Arguments too short");
        }
        return new BigInteger(1, Arrays.copyOfRange(args, offset, offset + WORD_LENGTH));
    }

    public static Hash160 decodeHash160(byte[] args, int offset) {
        if (args.length < offset + HASH160_LENGTH) {
            throw new BoundsException("decodeHash160", "Arguments too short");
        }
        return new Hash160(Arrays.copyOfRange(args, offset, offset + HASH160_LENGTH));
    }

    public static boolean hasSelector(byte[] payload, String signature) {
        return payload.length >= SELECTOR_LENGTH
                && Arrays.equals(Arrays.copyOf(payload, SELECTOR_LENGTH), selector(signature));
    }

    public static byte[] arguments(byte[] payload) {
        if (payload.length < SELECTOR_LENGTH) {
            return new byte[0];
        }
        return Arrays.copyOfRange(payload, SELECTOR_LENGTH, payload.length);
    }
}
