package com.axlabs.neo.timelock;

import io.neow3j.types.Hash160;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class Config {

    private static final String PROPS_FILE = "deploy.properties";
    private static Properties props;

    public static String getProperty(String name) {
        if (props == null) {
            props = load(PROPS_FILE);
        }
        return props.getProperty(name);
    }

    public static long getLongProperty(String name) {
        return Long.parseLong(getRequiredProperty(name));
    }

    /**
     * Reads a hash property. The value can either be a hex string (with or without '0x') or a Neo address.
     */
    public static Hash160 getHash160Property(String name) {
        String value = getRequiredProperty(name);
        if (value.startsWith("0x") || value.length() == 40) {
            return new Hash160(value);
        }
        return Hash160.fromAddress(value);
    }

    public static Hash160 getTimelockHash() {
        return getHash160Property("timelock");
    }

    private static String getRequiredProperty(String name) {
        String value = getProperty(name);
        if (value == null) {
            throw new RuntimeException("Missing property '" + name + "' in " + PROPS_FILE);
        }
        return value.trim();
    }

    static Properties load(String file) {
        Properties properties = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(file)) {
            if (in == null) {
                throw new IOException("Resource " + file + " not found");
            }
            properties.load(in);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return properties;
    }
}
