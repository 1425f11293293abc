package com.axlabs.neo.timelock;

import io.neow3j.types.ContractParameter;

import java.math.BigInteger;

import static io.neow3j.types.ContractParameter.array;
import static io.neow3j.types.ContractParameter.hash160;
import static io.neow3j.types.ContractParameter.integer;

public class DeployConfig {

    // property names
    static final String MEMBERSHIP_REGISTRY_KEY = "membership_registry";
    static final String ADMIN_KEY = "admin";
    static final String DELAY_KEY = "delay";
    static final String REDEMPTION_RATE_KEY = "redemption_rate";

    /**
     * Gets the deploy configuration for the timelock treasury. Requires that there is a 'deploy.properties' file
     * on the classpath in the following format:
     * <pre>
     *  membership_registry=0x95434943e07ab980dd9fbe4edc0edefb17a13517
     *  admin=NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP
     *  delay=172800
     *  redemption_rate=5000
     * </pre>
     * The redemption rate is optional and defaults to zero.
     *
     * @return the deploy parameter as [registry, admin, delay, redemptionRate].
     */
    static ContractParameter getTimelockDeployConfig() {
        String rate = Config.getProperty(REDEMPTION_RATE_KEY);
        return array(
                hash160(Config.getHash160Property(MEMBERSHIP_REGISTRY_KEY)),
                hash160(Config.getHash160Property(ADMIN_KEY)),
                integer(BigInteger.valueOf(Config.getLongProperty(DELAY_KEY))),
                integer(rate == null ? BigInteger.ZERO : new BigInteger(rate.trim()))
        );
    }
}
