package com.work.exchange.core.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class SimpleNodeIdProviderTest {

    @Test
    public void configured_id_is_used_without_owner_separator() {
        assertEquals("pod-7-a", new SimpleNodeIdProvider(" Pod:7:A ").getNodeId());
    }

    @Test
    public void blank_config_falls_back_to_generated_id() {
        String a = new SimpleNodeIdProvider("").getNodeId();
        String b = new SimpleNodeIdProvider(null).getNodeId();
        assertFalse(a.isEmpty());
        assertFalse(a.contains(":"));
        assertNotEquals(a, b);
    }
}
