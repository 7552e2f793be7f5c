package com.work.exchange.core.support;

import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.model.AppInfo;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryAppRegistryTest {

    private static final String OWNER = "0xAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAa";

    private final InMemoryAppRegistry registry = new InMemoryAppRegistry();

    @Test
    public void register_normalizes_owner_and_hashes_name() {
        AppInfo app = registry.register("weather-data", OWNER);

        assertEquals("weather-data", app.getName());
        assertEquals(OWNER.toLowerCase(), app.getOwner());
        assertEquals(Hash.sha3String("weather-data"), app.getHashedName());
        assertTrue(registry.exists("weather-data"));
        assertTrue(registry.isOwner("weather-data", OWNER));
        assertFalse(registry.isOwner("weather-data", "0x3333333333333333333333333333333333333333"));
    }

    @Test
    public void duplicate_and_missing_apps_fail() {
        registry.register("weather-data", OWNER);

        RegistryException dup = assertThrows(RegistryException.class,
                () -> registry.register("weather-data", "0x3333333333333333333333333333333333333333"));
        assertEquals(RegistryException.APP_ALREADY_EXISTS, dup.getMessage());

        RegistryException missing = assertThrows(RegistryException.class, () -> registry.get("ghost"));
        assertEquals(RegistryException.APP_NOT_FOUND, missing.getMessage());
        assertFalse(registry.exists("ghost"));
        assertFalse(registry.isOwner("ghost", OWNER));
    }

    @Test
    public void rejects_invalid_names_and_owners() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("bad name", OWNER));
        assertThrows(IllegalArgumentException.class, () -> registry.register("", OWNER));
        assertThrows(IllegalArgumentException.class, () -> registry.register("ok", "not-an-address"));
    }
}
