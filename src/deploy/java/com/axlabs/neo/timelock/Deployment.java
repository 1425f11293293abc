package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.Blockchain;
import io.neow3j.types.ContractParameter;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

public class Deployment {

    private static final Logger LOG = LoggerFactory.getLogger(Deployment.class);

    /**
     * Deploys the timelock treasury configured in 'deploy.properties' on the given chain.
     */
    public static TimelockTreasury deployTimelockTreasury(Blockchain blockchain) {
        return deployTimelockTreasury(blockchain, Config.getTimelockHash(), DeployConfig.getTimelockDeployConfig());
    }

    /**
     * Deploys a timelock treasury.
     * <p>
     * The data parameter has to be structured as follows:
     * <pre>
     * [
     *      Hash160 membershipRegistry,
     *      Hash160 admin,
     *      int delay,
     *      int redemptionRate
     * ]
     * </pre>
     *
     * @param blockchain   The chain to deploy to.
     * @param contractHash The hash to deploy the treasury under.
     * @param data         The deploy parameter.
     * @return the deployed treasury.
     */
    public static TimelockTreasury deployTimelockTreasury(Blockchain blockchain, Hash160 contractHash,
            ContractParameter data) {
        ContractParameter[] config = (ContractParameter[]) data.getValue();
        Hash160 registry = (Hash160) config[0].getValue();
        Hash160 admin = (Hash160) config[1].getValue();
        long delay = ((BigInteger) config[2].getValue()).longValueExact();
        BigInteger redemptionRate = (BigInteger) config[3].getValue();

        TimelockTreasury treasury = new TimelockTreasury(blockchain, contractHash, registry, admin, delay,
                redemptionRate);
        blockchain.deploy(contractHash, treasury);
        LOG.info("TimelockTreasury deployed at {} with admin {} and delay {}", contractHash, admin, delay);
        return treasury;
    }
}
