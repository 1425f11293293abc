package com.axlabs.neo.timelock;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.axlabs.neo.timelock.util.TestHelper.BOB;
import static io.neow3j.crypto.Hash.sha256;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CallDataTest {

    @Test
    public void selector_is_prefix_of_signature_hash() {
        byte[] hash = sha256("acceptAdmin()".getBytes(UTF_8));
        byte[] selector = CallData.selector("acceptAdmin()");

        assertThat(selector, is(new byte[]{hash[0], hash[1], hash[2], hash[3]}));
    }

    @Test
    public void encode_uint_pads_to_word() {
        byte[] word = CallData.encodeUint(BigInteger.valueOf(0x0102));
        assertThat(word.length, is(32));
        assertThat(word[30], is((byte) 0x01));
        assertThat(word[31], is((byte) 0x02));

        // 2^255 has a sign byte in its two's complement form.
        BigInteger large = BigInteger.ONE.shiftLeft(255);
        assertThat(CallData.decodeUint(CallData.encodeUint(large), 0), is(large));
        assertThat(CallData.decodeUint(CallData.encodeUint(FullMath.MAX_UINT256), 0), is(FullMath.MAX_UINT256));
    }

    @Test
    public void payload_arguments_follow_selector() {
        byte[] payload = CallData.encode(TimelockTreasury.SET_PENDING_ADMIN, CallData.encodeHash160(BOB));

        assertThat(CallData.hasSelector(payload, TimelockTreasury.SET_PENDING_ADMIN), is(true));
        assertThat(CallData.hasSelector(payload, TimelockTreasury.SET_DELAY), is(false));
        assertThat(CallData.decodeHash160(CallData.arguments(payload), 0), is(BOB));
    }

    @Test
    public void fail_decoding_short_arguments() {
        assertThrows(BoundsException.class, () -> CallData.decodeUint(new byte[31], 0));
        assertThrows(BoundsException.class, () -> CallData.decodeHash160(new byte[19], 0));
        assertThat(CallData.hasSelector(new byte[3], TimelockTreasury.ACCEPT_ADMIN), is(false));
    }
}
