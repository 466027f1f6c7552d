package com.distributedsystems.bhr.util;

import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.service.BlockRegistry;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockCsvCodecTest {

    private final BlockCsvCodec codec = new BlockCsvCodec();

    @Test
    void exportWritesHeaderAndQuotesFreeText() {
        BlockEntity permanent = BlockEntity.builder()
                .id(1L)
                .cidr(Network.parse("1.2.3.4"))
                .requestedBy("admin")
                .source("ids")
                .reason("scan, then brute force")
                .createdAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
        BlockEntity timed = BlockEntity.builder()
                .id(2L)
                .cidr(Network.parse("2001:db8::/32"))
                .requestedBy("admin")
                .source("feed")
                .reason("spam")
                .createdAt(Instant.parse("2024-03-01T12:00:00Z"))
                .expiresAt(Instant.parse("2024-03-01T13:00:00Z"))
                .build();

        String[] lines = codec.write(List.of(permanent, timed)).split("\r\n");

        assertEquals("cidr,who,source,why,added,unblock_at", lines[0]);
        assertEquals("1.2.3.4/32,admin,ids,\"scan, then brute force\",2024-03-01T12:00:00Z,", lines[1]);
        assertEquals("2001:db8::/32,admin,feed,spam,2024-03-01T12:00:00Z,2024-03-01T13:00:00Z", lines[2]);
    }

    @Test
    void emptyExportIsJustTheHeader() {
        assertEquals("cidr,who,source,why,added,unblock_at\r\n", codec.write(List.of()));
    }

    @Test
    void readsRequiredAndOptionalColumns() {
        String csv = "CIDR,Source,Why,Duration,Skip_Whitelist\n"
                + "1.2.3.4, ids ,scan,600,yes\n"
                + "\n"
                + "5.6.7.0/24,feed,spam,,\n";

        List<BlockRegistry.BulkRequest> rows = codec.read(new StringReader(csv));

        assertEquals(2, rows.size());
        assertEquals(new BlockRegistry.BulkRequest("1.2.3.4", "ids", "scan", 600L, true), rows.get(0));
        assertEquals(new BlockRegistry.BulkRequest("5.6.7.0/24", "feed", "spam", null, false), rows.get(1));
    }

    @Test
    void optionalColumnsMayBeAbsent() {
        List<BlockRegistry.BulkRequest> rows = codec.read(new StringReader("cidr,source,why\n10.0.0.0/8,feed,bogon\n"));
        assertNull(rows.get(0).durationSeconds());
        assertFalse(rows.get(0).skipWhitelist());
    }

    @Test
    void missingRequiredColumnIsRejected() {
        InvalidBlockRequestException e = assertThrows(InvalidBlockRequestException.class,
                () -> codec.read(new StringReader("cidr,why\n1.2.3.4,scan\n")));
        assertTrue(e.getMessage().contains("'source'"));
    }

    @Test
    void nonNumericDurationIsRejected() {
        InvalidBlockRequestException e = assertThrows(InvalidBlockRequestException.class,
                () -> codec.read(new StringReader("cidr,source,why,duration\n1.2.3.4,ids,scan,soon\n")));
        assertTrue(e.getMessage().contains("soon"));
    }
}
