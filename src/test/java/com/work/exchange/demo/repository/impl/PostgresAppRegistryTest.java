package com.work.exchange.demo.repository.impl;

import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.model.AppInfo;
import com.work.exchange.demo.config.ExchangeProperties;
import com.work.exchange.demo.repository.entity.AppEntity;
import com.work.exchange.demo.repository.mapper.AppMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PostgresAppRegistryTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";

    private AppMapper appMapper;
    private PostgresAppRegistry registry;

    @BeforeEach
    public void setUp() {
        appMapper = mock(AppMapper.class);
        registry = new PostgresAppRegistry(appMapper, new ExchangeProperties());
    }

    @Test
    public void lookups_are_served_from_cache_after_first_load() {
        AppEntity entity = new AppEntity();
        entity.setName("weather-data");
        entity.setOwner(OWNER);
        entity.setHashedName("0xabc");
        when(appMapper.selectByName("weather-data")).thenReturn(entity);

        assertTrue(registry.exists("weather-data"));
        assertTrue(registry.isOwner("weather-data", OWNER));
        AppInfo app = registry.get("weather-data");

        assertEquals(OWNER, app.getOwner());
        verify(appMapper, times(1)).selectByName("weather-data");
    }

    @Test
    public void missing_app_is_not_cached() {
        when(appMapper.selectByName("ghost")).thenReturn(null);

        assertFalse(registry.exists("ghost"));
        RegistryException e = assertThrows(RegistryException.class, () -> registry.get("ghost"));
        assertEquals(RegistryException.APP_NOT_FOUND, e.getMessage());
        verify(appMapper, times(2)).selectByName("ghost");
    }

    @Test
    public void register_fails_when_name_is_taken() {
        when(appMapper.insertIfNotExists(eq("weather-data"), eq(OWNER), anyString(), any(Instant.class))).thenReturn(1, 0);

        AppInfo app = registry.register("weather-data", OWNER);
        RegistryException e = assertThrows(RegistryException.class, () -> registry.register("weather-data", OWNER));

        assertEquals(RegistryException.APP_ALREADY_EXISTS, e.getMessage());
        assertEquals(app.getHashedName(), registry.get("weather-data").getHashedName());
        verify(appMapper, never()).selectByName(anyString());
    }
}
