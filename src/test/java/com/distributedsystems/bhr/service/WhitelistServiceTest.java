package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.RegistryTestSupport;
import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exception.InvalidNetworkException;
import com.distributedsystems.bhr.exception.NoSuchWhitelistEntryException;
import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.util.Network;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WhitelistServiceTest extends RegistryTestSupport {

    @Autowired WhitelistService whitelistService;
    @Autowired WhitelistMatcher matcher;

    @Test
    void entryProtectsItselfAndEverythingInside() {
        whitelistService.add("10.0.0.0/8", "admin", "internal");

        assertTrue(matcher.isWhitelisted(Network.parse("10.0.0.0/8")));
        assertTrue(matcher.isWhitelisted(Network.parse("10.1.2.0/24")));
        assertTrue(matcher.isWhitelisted(Network.parse("10.255.255.255")));
        assertFalse(matcher.isWhitelisted(Network.parse("11.0.0.1")));
        assertFalse(matcher.isWhitelisted(Network.parse("0.0.0.0/0")));
    }

    @Test
    void familiesDoNotMix() {
        whitelistService.add("::/0", "admin", "all of v6");
        assertTrue(matcher.isWhitelisted(Network.parse("2001:db8::1")));
        assertFalse(matcher.isWhitelisted(Network.parse("1.2.3.4")));
    }

    @Test
    void matcherReportsTheCoveringEntry() {
        whitelistService.add("192.168.0.0/16", "admin", "lab");
        WhitelistEntryEntity hit = matcher.findCovering(Network.parse("192.168.4.4")).orElseThrow();
        assertEquals("192.168.0.0/16", hit.getCidr().toText());
        assertEquals("lab", hit.getWhy());
    }

    @Test
    void addingTwiceKeepsTheFirstEntry() {
        WhitelistEntryEntity first = whitelistService.add("1.2.3.4", "alice", "resolver");
        WhitelistEntryEntity second = whitelistService.add("1.2.3.4/32", "bob", "other");
        assertEquals(first.getId(), second.getId());
        assertEquals("alice", second.getWho());
        assertEquals(1, whitelistRepository.count());
    }

    @Test
    void reasonAndValidNetworkAreRequired() {
        assertThrows(InvalidBlockRequestException.class, () -> whitelistService.add("1.2.3.4", "admin", " "));
        assertThrows(InvalidNetworkException.class, () -> whitelistService.add("1.2.3.4/8", "admin", "x"));
    }

    @Test
    void listIsSortedAndRemoveDeletes() {
        whitelistService.add("9.9.9.9", "admin", "b");
        WhitelistEntryEntity a = whitelistService.add("1.1.1.1", "admin", "a");

        assertEquals(List.of("1.1.1.1/32", "9.9.9.9/32"),
                whitelistService.list().stream().map(e -> e.getCidr().toText()).toList());

        whitelistService.remove(a.getId());
        assertEquals(1, whitelistService.list().size());
        assertFalse(matcher.isWhitelisted(Network.parse("1.1.1.1")));
        assertThrows(NoSuchWhitelistEntryException.class, () -> whitelistService.remove(a.getId()));
    }
}
