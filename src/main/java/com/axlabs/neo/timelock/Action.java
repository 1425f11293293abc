package com.axlabs.neo.timelock;

import io.neow3j.crypto.Hash;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * An administrative call that can be queued on the timelock. Actions are never stored. The timelock only stores
 * their {@link #fingerprint()}.
 */
public class Action {

    private static final int VALUE_LENGTH = 32;

    /**
     * The contract or account to call.
     */
    private final Hash160 target;

    /**
     * The native value to send with the call.
     */
    private final BigInteger value;

    /**
     * The function signature, e.g. {@code setDelay(uint256)}. Empty if {@link #data} is the full payload.
     */
    private final String signature;

    /**
     * The encoded arguments, or the full payload if there is no signature.
     */
    private final byte[] data;

    /**
     * The earliest time (seconds) at which the action can be executed.
     */
    private final long eta;

    public Action(Hash160 target, BigInteger value, String signature, byte[] data, long eta) {
        if (target == null) {
            throw new BoundsException("Action", "Target is missing");
        }
        if (!FullMath.isUint256(value)) {
            throw new BoundsException("Action", "Invalid value");
        }
        this.target = target;
        this.value = value;
        this.signature = signature == null ? "" : signature;
        this.data = data == null ? new byte[0] : data.clone();
        this.eta = eta;
    }

    public Hash160 getTarget() {
        return target;
    }

    public BigInteger getValue() {
        return value;
    }

    public String getSignature() {
        return signature;
    }

    public byte[] getData() {
        return data.clone();
    }

    public long getEta() {
        return eta;
    }

    /**
     * Calculates the SHA-256 hash over the serialized action. The serialization is
     * <pre>
     * target (20 bytes) | value (32 bytes) | signature length (4 bytes) | signature (UTF-8) |
     * data length (4 bytes) | data | eta (8 bytes)
     * </pre>
     *
     * @return the fingerprint of this action.
     */
    public Hash256 fingerprint() {
        byte[] sig = signature.getBytes(UTF_8);
        byte[] serialized = ByteBuffer.allocate(CallData.HASH160_LENGTH + VALUE_LENGTH + 4 + sig.length + 4
                        + data.length + 8)
                .put(target.toArray())
                .put(CallData.encodeUint(value))
                .putInt(sig.length)
                .put(sig)
                .putInt(data.length)
                .put(data)
                .putLong(eta)
                .array();
        return new Hash256(Hash.sha256(serialized));
    }

    /**
     * @return the payload sent to the target on execution.
     */
    public byte[] payload() {
        return CallData.encode(signature, data);
    }
}
