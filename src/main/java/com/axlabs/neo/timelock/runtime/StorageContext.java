package com.axlabs.neo.timelock.runtime;

import io.neow3j.types.Hash160;
import io.neow3j.utils.Numeric;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The persistent key-value storage of a single contract.
 * <p>
 * Values are copied on the way in and out, so callers can never mutate stored bytes. Integers are stored as
 * big-endian two's complement bytes and hashes in their big-endian form.
 */
public class StorageContext {

    private final Hash160 contract;
    private Map<String, byte[]> entries = new HashMap<>();

    StorageContext(Hash160 contract) {
        this.contract = contract;
    }

    public Hash160 getContract() {
        return contract;
    }

    public byte[] get(byte[] key) {
        byte[] value = entries.get(Numeric.toHexStringNoPrefix(key));
        return value == null ? null : value.clone();
    }

    public byte[] get(String key) {
        return get(key.getBytes(UTF_8));
    }

    public BigInteger getBigInteger(String key) {
        byte[] value = get(key);
        return value == null ? BigInteger.ZERO : new BigInteger(value);
    }

    public long getLong(String key) {
        return getBigInteger(key).longValueExact();
    }

    public Hash160 getHash160(String key) {
        byte[] value = get(key);
        return value == null ? null : new Hash160(value);
    }

    public void put(byte[] key, byte[] value) {
        entries.put(Numeric.toHexStringNoPrefix(key), value.clone());
    }

    public void put(String key, byte[] value) {
        put(key.getBytes(UTF_8), value);
    }

    public void put(String key, BigInteger value) {
        put(key, value.toByteArray());
    }

    public void put(String key, long value) {
        put(key, BigInteger.valueOf(value));
    }

    public void put(String key, Hash160 value) {
        put(key, value.toArray());
    }

    public void delete(byte[] key) {
        entries.remove(Numeric.toHexStringNoPrefix(key));
    }

    public void delete(String key) {
        delete(key.getBytes(UTF_8));
    }

    Map<String, byte[]> copyEntries() {
        return new HashMap<>(entries);
    }

    void restoreEntries(Map<String, byte[]> snapshot) {
        entries = new HashMap<>(snapshot);
    }
}
