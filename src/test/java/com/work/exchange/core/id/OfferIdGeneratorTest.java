package com.work.exchange.core.id;

import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import static org.junit.jupiter.api.Assertions.*;

public class OfferIdGeneratorTest {

    private static final String CREATOR = "0x1111111111111111111111111111111111111111";

    private final OfferIdGenerator generator = new OfferIdGenerator();

    @Test
    public void id_is_first_8_bytes_of_keccak_over_packed_inputs() {
        String packed = CREATOR
                + String.format("%064x", 5L)
                + String.format("%064x", 2L);
        String expected = Numeric.toHexString(Hash.sha3(Numeric.hexStringToByteArray(packed))).substring(0, 18);

        assertEquals(expected, generator.generate(CREATOR, 5L, 2L));
    }

    @Test
    public void same_inputs_give_same_id_and_any_change_gives_another() {
        String id = generator.generate(CREATOR, 10L, 0L);

        assertNotEquals(id, generator.generate(CREATOR, 11L, 0L));
        assertNotEquals(id, generator.generate(CREATOR, 10L, 1L));
        assertNotEquals(id, generator.generate("0x2222222222222222222222222222222222222222", 10L, 0L));
        assertTrue(id.matches("^0x[0-9a-f]{16}$"));
    }

    @Test
    public void rejects_invalid_creator_and_negative_inputs() {
        assertThrows(IllegalArgumentException.class, () -> generator.generate("0x1234", 1L, 0L));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(CREATOR, -1L, 0L));
        assertThrows(IllegalArgumentException.class, () -> generator.generate(CREATOR, 1L, -1L));
    }
}
