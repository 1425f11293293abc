package com.axlabs.neo.timelock.runtime;

import java.math.BigInteger;

/**
 * A view on a {@link StorageContext} that prepends a one byte prefix to every key.
 */
public class StorageMap {

    private final StorageContext context;
    private final byte prefix;

    public StorageMap(StorageContext context, int prefix) {
        this.context = context;
        this.prefix = (byte) prefix;
    }

    public byte[] get(byte[] key) {
        return context.get(prefixed(key));
    }

    public boolean getBoolean(byte[] key) {
        byte[] value = get(key);
        return value != null && new BigInteger(value).signum() != 0;
    }

    public void put(byte[] key, byte[] value) {
        context.put(prefixed(key), value);
    }

    public void put(byte[] key, boolean value) {
        put(key, BigInteger.valueOf(value ? 1 : 0).toByteArray());
    }

    public void delete(byte[] key) {
        context.delete(prefixed(key));
    }

    private byte[] prefixed(byte[] key) {
        byte[] k = new byte[key.length + 1];
        k[0] = prefix;
        System.arraycopy(key, 0, k, 1, key.length);
        return k;
    }
}
