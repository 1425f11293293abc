package com.axlabs.neo.timelock;

import com.axlabs.neo.timelock.runtime.InvocationResult;
import com.axlabs.neo.timelock.runtime.LocalChain;
import com.axlabs.neo.timelock.util.TestProposalSource;
import com.axlabs.neo.timelock.util.TestTarget;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.axlabs.neo.timelock.AdminAuthority.MAXIMUM_DELAY;
import static com.axlabs.neo.timelock.AdminAuthority.MINIMUM_DELAY;
import static com.axlabs.neo.timelock.TimelockTreasury.ACCEPT_ADMIN;
import static com.axlabs.neo.timelock.TimelockTreasury.SET_DELAY;
import static com.axlabs.neo.timelock.TimelockTreasury.SET_PENDING_ADMIN;
import static com.axlabs.neo.timelock.util.TestHelper.ALICE;
import static com.axlabs.neo.timelock.util.TestHelper.BOB;
import static com.axlabs.neo.timelock.util.TestHelper.CHARLIE;
import static com.axlabs.neo.timelock.util.TestHelper.DAY;
import static com.axlabs.neo.timelock.util.TestHelper.DELAY;
import static com.axlabs.neo.timelock.util.TestHelper.NEW_ADMIN;
import static com.axlabs.neo.timelock.util.TestHelper.NEW_DELAY;
import static com.axlabs.neo.timelock.util.TestHelper.NEW_PENDING_ADMIN;
import static com.axlabs.neo.timelock.util.TestHelper.REGISTRY;
import static com.axlabs.neo.timelock.util.TestHelper.START_TIME;
import static com.axlabs.neo.timelock.util.TestHelper.TARGET;
import static com.axlabs.neo.timelock.util.TestHelper.TIMELOCK;
import static com.axlabs.neo.timelock.util.TestHelper.lastNotification;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AdminAuthorityTest {

    private LocalChain chain;
    private TimelockTreasury timelock;
    private TestTarget target;

    @BeforeEach
    public void setUp() {
        chain = new LocalChain(START_TIME);
        chain.deploy(ALICE, new TestProposalSource());
        target = new TestTarget();
        chain.deploy(TARGET, target);
        timelock = new TimelockTreasury(chain, TIMELOCK, REGISTRY, ALICE, DELAY);
        chain.deploy(TIMELOCK, timelock);
    }

    /**
     * Queues a call of the timelock on itself, waits for the delay and executes it.
     */
    private void executeOnTimelock(String signature, byte[] data) {
        long eta = chain.getTime() + timelock.getDelay();
        timelock.queueTransaction(ALICE, TIMELOCK, BigInteger.ZERO, signature, data, eta);
        chain.setTime(eta);
        timelock.executeTransaction(ALICE, TIMELOCK, BigInteger.ZERO, signature, data, eta);
    }

    //region DEPLOY

    @Test
    public void deploy_with_initial_admin_and_delay() {
        assertThat(timelock.getAdmin(), is(ALICE));
        assertThat(timelock.getPendingAdmin(), is(nullValue()));
        assertThat(timelock.getDelay(), is(DELAY));
        assertThat(timelock.getProposalSource(), is(ALICE));
    }

    @Test
    public void deploy_with_delay_at_bounds() {
        LocalChain other = new LocalChain(START_TIME);
        assertThat(new TimelockTreasury(other, TIMELOCK, REGISTRY, ALICE, MINIMUM_DELAY).getDelay(),
                is(MINIMUM_DELAY));
        assertThat(new TimelockTreasury(other, TARGET, REGISTRY, ALICE, MAXIMUM_DELAY).getDelay(),
                is(MAXIMUM_DELAY));
    }

    @Test
    public void fail_deploy_with_delay_below_minimum() {
        BoundsException e = assertThrows(BoundsException.class,
                () -> new TimelockTreasury(new LocalChain(START_TIME), TIMELOCK, REGISTRY, ALICE, MINIMUM_DELAY - 1));
        assertThat(e.getMessage(), is("deploy: Delay must exceed minimum delay"));
    }

    @Test
    public void fail_deploy_with_delay_above_maximum() {
        BoundsException e = assertThrows(BoundsException.class,
                () -> new TimelockTreasury(new LocalChain(START_TIME), TIMELOCK, REGISTRY, ALICE, MAXIMUM_DELAY + 1));
        assertThat(e.getMessage(), is("deploy: Delay must not exceed maximum delay"));
    }

    @Test
    public void fail_deploy_with_zero_admin() {
        BoundsException e = assertThrows(BoundsException.class,
                () -> new TimelockTreasury(new LocalChain(START_TIME), TIMELOCK, REGISTRY, Hash160.ZERO, DELAY));
        assertThat(e.getMessage(), is("deploy: Invalid admin hash"));
    }
    //endregion DEPLOY

    //region DELAY

    @Test
    public void fail_set_delay_directly() {
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> timelock.setDelay(3 * DAY));

        assertThat(e.getMessage(), is("setDelay: Call must come from the timelock"));
        assertThat(timelock.getDelay(), is(DELAY));
    }

    @Test
    public void set_delay_through_timelock() {
        executeOnTimelock(SET_DELAY, CallData.encodeUint(10 * DAY));

        assertThat(timelock.getDelay(), is(10 * DAY));
        assertThat(lastNotification(chain, NEW_DELAY).getState().get(0), is(10 * DAY));
    }

    @Test
    public void fail_set_delay_out_of_bounds_through_timelock() {
        ExternalCallException e = assertThrows(ExternalCallException.class,
                () -> executeOnTimelock(SET_DELAY, CallData.encodeUint(MAXIMUM_DELAY + 1)));

        assertThat(e.getMessage(), containsString("setDelay: Delay must not exceed maximum delay"));
        assertThat(timelock.getDelay(), is(DELAY));
        assertThat(chain.getNotifications(NEW_DELAY), is(empty()));
    }

    @Test
    public void fail_set_delay_above_long_range_through_timelock() {
        ExternalCallException e = assertThrows(ExternalCallException.class,
                () -> executeOnTimelock(SET_DELAY, CallData.encodeUint(BigInteger.TWO.pow(64))));

        assertThat(e.getMessage(), containsString("setDelay: Delay must not exceed maximum delay"));
        assertThat(timelock.getDelay(), is(DELAY));
    }

    @Test
    public void fail_self_call_outside_executed_action() {
        byte[] payload = CallData.encode(SET_DELAY, CallData.encodeUint(MAXIMUM_DELAY));

        InvocationResult fromTimelock = chain.invoke(TIMELOCK, TIMELOCK, BigInteger.ZERO, payload);
        InvocationResult fromAdmin = chain.invoke(ALICE, TIMELOCK, BigInteger.ZERO, payload);

        assertThat(fromTimelock.isSuccess(), is(false));
        assertThat(fromTimelock.getException(), is("setDelay: Call must come from the timelock"));
        assertThat(fromAdmin.isSuccess(), is(false));
        assertThat(timelock.getDelay(), is(DELAY));
        assertThat(chain.getNotifications(NEW_DELAY), is(empty()));
    }

    @Test
    public void fail_set_delay_from_target_of_executed_action() {
        List<RuntimeException> failures = new ArrayList<>();
        List<InvocationResult> results = new ArrayList<>();
        target.setHook(call -> {
            try {
                timelock.setDelay(MAXIMUM_DELAY);
            } catch (AuthorizationException e) {
                failures.add(e);
            }
            results.add(chain.invoke(TIMELOCK, TIMELOCK, BigInteger.ZERO,
                    CallData.encode(SET_DELAY, CallData.encodeUint(MAXIMUM_DELAY))));
        });
        long eta = chain.getTime() + DELAY;
        timelock.queueTransaction(ALICE, TARGET, BigInteger.ZERO, "", new byte[0], eta);
        chain.setTime(eta);

        timelock.executeTransaction(ALICE, TARGET, BigInteger.ZERO, "", new byte[0], eta);

        assertThat(failures, hasSize(1));
        assertThat(failures.get(0).getMessage(), is("setDelay: Call must come from the timelock"));
        assertThat(results.get(0).isSuccess(), is(false));
        assertThat(results.get(0).getException(), containsString("is not the executing contract"));
        assertThat(timelock.getDelay(), is(DELAY));
    }

    @Test
    public void new_delay_applies_to_later_queueing_only() {
        long earlyEta = chain.getTime() + DELAY + DAY;
        timelock.queueTransaction(ALICE, TARGET, BigInteger.ZERO, "", new byte[0], earlyEta);

        executeOnTimelock(SET_DELAY, CallData.encodeUint(10 * DAY));

        assertThrows(PreconditionException.class, () -> timelock.queueTransaction(ALICE, TARGET, BigInteger.ZERO,
                "", new byte[0], chain.getTime() + DELAY));
        chain.setTime(earlyEta);
        timelock.executeTransaction(ALICE, TARGET, BigInteger.ZERO, "", new byte[0], earlyEta);
    }
    //endregion DELAY

    //region ADMIN

    @Test
    public void fail_set_pending_admin_directly() {
        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> timelock.setPendingAdmin(BOB));

        assertThat(e.getMessage(), is("setPendingAdmin: Call must come from the timelock"));
        assertThat(timelock.getPendingAdmin(), is(nullValue()));
    }

    @Test
    public void fail_transfer_admin_role_outside_executed_action() {
        assertThrows(AuthorizationException.class, () -> timelock.setDelay(MAXIMUM_DELAY));
        assertThrows(AuthorizationException.class, () -> timelock.setPendingAdmin(BOB));
        assertThrows(AuthorizationException.class, () -> timelock.acceptAdmin(BOB));

        assertThat(timelock.getDelay(), is(DELAY));
        assertThat(timelock.getAdmin(), is(ALICE));
        assertThat(timelock.getPendingAdmin(), is(nullValue()));
        assertThat(chain.getNotifications(NEW_PENDING_ADMIN), is(empty()));
    }

    @Test
    public void transfer_admin_role() {
        executeOnTimelock(SET_PENDING_ADMIN, CallData.encodeHash160(BOB));

        assertThat(timelock.getPendingAdmin(), is(BOB));
        assertThat(lastNotification(chain, NEW_PENDING_ADMIN).getState().get(0), is(BOB));

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> timelock.acceptAdmin(CHARLIE));
        assertThat(e.getMessage(), is("acceptAdmin: Call must come from pendingAdmin"));

        timelock.acceptAdmin(BOB);

        assertThat(timelock.getAdmin(), is(BOB));
        assertThat(timelock.getPendingAdmin(), is(nullValue()));
        assertThat(lastNotification(chain, NEW_ADMIN).getState().get(0), is(BOB));
        assertThrows(AuthorizationException.class, () -> timelock.queueTransaction(ALICE, TARGET, BigInteger.ZERO,
                "", new byte[0], chain.getTime() + DELAY));
        timelock.queueTransaction(BOB, TARGET, BigInteger.ZERO, "", new byte[0], chain.getTime() + DELAY);
    }

    @Test
    public void fail_accept_admin_without_pending_admin() {
        assertThrows(AuthorizationException.class, () -> timelock.acceptAdmin(BOB));
        assertThat(timelock.getAdmin(), is(ALICE));
    }

    @Test
    public void fail_accept_admin_if_pending_admin_is_zero_hash() {
        executeOnTimelock(SET_PENDING_ADMIN, CallData.encodeHash160(Hash160.ZERO));
        assertThat(timelock.getPendingAdmin(), is(Hash160.ZERO));

        assertThrows(AuthorizationException.class, () -> timelock.acceptAdmin(Hash160.ZERO));
        assertThat(timelock.getAdmin(), is(ALICE));
    }

    @Test
    public void fail_accept_admin_through_timelock_if_not_pending() {
        ExternalCallException e = assertThrows(ExternalCallException.class,
                () -> executeOnTimelock(ACCEPT_ADMIN, new byte[0]));

        assertThat(e.getMessage(), containsString("acceptAdmin: Call must come from pendingAdmin"));
    }
    //endregion ADMIN
}
