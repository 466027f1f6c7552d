package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.RegistryTestSupport;
import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.model.BlockEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockViewsTest extends RegistryTestSupport {

    @Autowired BlockRegistry registry;
    @Autowired BlockViews views;

    private void addNetworks(int count) {
        for (int i = 0; i < count; i++) {
            registry.addBlock("10.0." + (i / 256) + "." + (i % 256), "admin", "feed", "bulk");
            clock.advance(Duration.ofSeconds(1));
        }
    }

    @Test
    void queueIsOldestFirst() {
        registry.addBlock("3.3.3.3", "admin", "feed", "third");
        clock.advance(Duration.ofSeconds(1));
        registry.addBlock("1.1.1.1", "admin", "feed", "first");
        clock.advance(Duration.ofSeconds(1));
        registry.addBlock("2.2.2.2", "admin", "feed", "second");

        List<String> order = views.queue("bgp1").stream().map(b -> b.getCidr().toText()).toList();
        assertEquals(List.of("3.3.3.3/32", "1.1.1.1/32", "2.2.2.2/32"), order);
    }

    @Test
    void queueHonoursRequestedAndDefaultLimits() {
        addNetworks(120);

        assertEquals(100, views.queue("bgp1").size());
        assertEquals(5, views.queue("bgp1", 5).size());
        assertEquals(120, views.queue("bgp1", 10_000).size());
    }

    @Test
    void queueLimitIsCappedAtTheConfiguredMaximum() {
        addNetworks(505);
        assertEquals(500, views.queue("bgp1", 600).size());
    }

    @Test
    void blankAgentIsRejected() {
        assertThrows(InvalidBlockRequestException.class, () -> views.queue(" "));
        assertThrows(InvalidBlockRequestException.class, () -> views.unblockQueue(null, null));
    }

    @Test
    void unblockQueueListsOnlyWithdrawnBlocksTheAgentStillHolds() {
        BlockEntity held = registry.addBlock("1.2.3.4", "admin", "feed", "x");
        BlockEntity neverApplied = registry.addBlock("5.6.7.8", "admin", "feed", "y");
        BlockEntity stillLive = registry.addBlock("9.9.9.9", "admin", "feed", "z");
        registry.setBlocked("1.2.3.4", "bgp1");
        registry.setBlocked("9.9.9.9", "bgp1");

        registry.withdraw(held.getId());
        registry.withdraw(neverApplied.getId());

        List<BlockEntity> unblock = views.unblockQueue("bgp1", null);
        assertEquals(1, unblock.size());
        assertEquals(held.getId(), unblock.get(0).getId());
        assertTrue(views.unblockQueue("bgp2", null).isEmpty());
        assertEquals(List.of(stillLive.getId()), views.current().stream().map(BlockEntity::getId).toList());
    }

    @Test
    void reblockedNetworkStaysOutOfTheUnblockQueue() {
        BlockEntity first = registry.addBlock("1.2.3.4", "admin", "feed", "x");
        registry.setBlocked("1.2.3.4", "bgp1");
        registry.withdraw(first.getId());
        assertEquals(1, views.unblockQueue("bgp1", null).size());

        BlockEntity second = registry.addBlock("1.2.3.4", "admin", "feed", "again");
        registry.setBlocked("1.2.3.4", "bgp1");

        assertTrue(views.unblockQueue("bgp1", null).isEmpty());
        assertEquals(List.of(second.getId()), views.current().stream().map(BlockEntity::getId).toList());

        registry.withdraw(second.getId());
        List<Long> unblock = views.unblockQueue("bgp1", null).stream().map(BlockEntity::getId).toList();
        assertEquals(List.of(first.getId(), second.getId()), unblock);
    }

    @Test
    void viewsPartitionTheExpectedSet() {
        registry.addBlock("1.1.1.1", "admin", "feed", "a");
        registry.addBlock("2.2.2.2", "admin", "feed", "b");
        registry.addBlock("2001:db8::/32", "admin", "feed", "c");
        registry.setBlocked("2.2.2.2", "bgp1");
        registry.setBlocked("2.2.2.2", "bgp2");
        registry.setBlocked("2001:db8::/32", "bgp2");

        assertEquals(3, views.expected().size());
        assertEquals(2, views.current().size());
        assertEquals(1, views.pending().size());
        assertEquals(views.expected().size(), views.current().size() + views.pending().size());
    }

    @Test
    void statsCountLiveBlocksAndPerAgentConfirmations() {
        BlockEntity a = registry.addBlock("1.1.1.1", "admin", "feed", "a");
        registry.addBlock("2.2.2.2", "admin", "feed", "b");
        registry.addBlock("3.3.3.3", "admin", "feed", "c");
        registry.setBlocked("1.1.1.1", "bgp1");
        registry.setBlocked("2.2.2.2", "bgp1");
        registry.setBlocked("2.2.2.2", "bgp2");
        registry.withdraw(a.getId());

        BlockViews.BlockStats stats = views.stats();

        assertEquals(2, stats.expected());
        assertEquals(1, stats.current());
        assertEquals(1, stats.pending());
        assertEquals(Map.of("bgp1", 1L, "bgp2", 1L), stats.agents());
    }
}
