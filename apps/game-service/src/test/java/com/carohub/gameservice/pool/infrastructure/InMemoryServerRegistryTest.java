package com.carohub.gameservice.pool.infrastructure;

import com.carohub.gameservice.pool.domain.PoolProperties;
import com.carohub.gameservice.pool.domain.model.ServerRecord;
import com.carohub.gameservice.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryServerRegistryTest {

    private final MutableClock clock = MutableClock.startingAt(1_700_000_000_000L);
    private final InMemoryServerRegistry registry = new InMemoryServerRegistry(new PoolProperties(), clock);

    @Test
    void shouldKeepRegistrationOrderAcrossReRegister() {
        registry.register("s1", "10.0.0.1", 9000, 100, "eu");
        registry.register("s2", "10.0.0.2", 9000, 150, "eu");
        registry.tryAddSession("s1", "m1");

        ServerRecord again = registry.register("s1", "10.0.0.9", 9100, 120, "eu");

        assertEquals(1, again.getRegistrationSeq());
        assertEquals(1, again.getActiveSessions());
        assertEquals("10.0.0.9", again.getHost());
        assertEquals(List.of("s1", "s2"), registry.findAll().stream().map(ServerRecord::getServerId).toList());
    }

    @Test
    void shouldDeriveHealthFromHeartbeatAge() {
        registry.register("s1", "h", 1, 10, "eu");

        clock.advanceSeconds(59);
        assertTrue(registry.find("s1").orElseThrow().isHealthy());
        clock.advanceSeconds(1);
        assertFalse(registry.find("s1").orElseThrow().isHealthy());

        assertTrue(registry.heartbeat("s1", 0.5, null));
        ServerRecord rec = registry.find("s1").orElseThrow();
        assertTrue(rec.isHealthy());
        assertEquals(0.5, rec.getCpuUsage());
    }

    @Test
    void shouldRejectHeartbeatFromUnknownServer() {
        assertFalse(registry.heartbeat("ghost", null, null));
        assertTrue(registry.find("ghost").isEmpty());
    }

    @Test
    void shouldCountSessionsAsSet() {
        registry.register("s1", "h", 1, 10, "eu");

        assertEquals(1, registry.tryAddSession("s1", "m1"));
        assertEquals(1, registry.tryAddSession("s1", "m1"));
        assertEquals(2, registry.tryAddSession("s1", "m2"));
        assertTrue(registry.removeSession("s1", "m1"));
        assertFalse(registry.removeSession("s1", "m1"));
        assertEquals(1, registry.find("s1").orElseThrow().getActiveSessions());
    }

    @Test
    void shouldDropSessionsOnUnregister() {
        registry.register("s1", "h", 1, 10, "eu");
        registry.tryAddSession("s1", "m1");

        assertTrue(registry.unregister("s1"));
        assertFalse(registry.unregister("s1"));
        assertFalse(registry.removeSession("s1", "m1"));
    }

    @Test
    void shouldRefuseSessionBeyondCapacity() {
        registry.register("s1", "h", 1, 2, "eu");

        assertEquals(1, registry.tryAddSession("s1", "m1"));
        assertEquals(2, registry.tryAddSession("s1", "m2"));
        assertEquals(-1, registry.tryAddSession("s1", "m3"));
        // 已在集合中的对局不占新名额
        assertEquals(2, registry.tryAddSession("s1", "m2"));
        assertEquals(2, registry.find("s1").orElseThrow().getActiveSessions());
    }

    @Test
    void shouldRefuseSessionOnUnregisteredOrSilentServer() {
        assertEquals(-1, registry.tryAddSession("ghost", "m1"));
        registry.register("s1", "h", 1, 10, "eu");
        assertTrue(registry.unregister("s1"));
        assertEquals(-1, registry.tryAddSession("s1", "m1"));

        registry.register("s2", "h", 1, 10, "eu");
        clock.advanceSeconds(60);
        assertEquals(-1, registry.tryAddSession("s2", "m1"));
        assertEquals(0, registry.find("s2").orElseThrow().getActiveSessions());
    }
}
