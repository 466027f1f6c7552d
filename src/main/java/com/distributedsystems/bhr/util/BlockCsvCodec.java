package com.distributedsystems.bhr.util;

import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.service.BlockRegistry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSV export of the expected list and parsing of bulk block uploads.
 *
 * <p>Bulk uploads need a header row with {@code cidr,source,why}; {@code duration}
 * (seconds) and {@code skip_whitelist} are optional columns.</p>
 */
@Component
public class BlockCsvCodec {

    static final String[] EXPORT_HEADER = {"cidr", "who", "source", "why", "added", "unblock_at"};

    public String write(List<BlockEntity> blocks) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.withHeader(EXPORT_HEADER))) {
            for (BlockEntity b : blocks) {
                printer.printRecord(
                        b.getCidr().toText(),
                        b.getRequestedBy(),
                        b.getSource(),
                        b.getReason(),
                        b.getCreatedAt(),
                        b.getExpiresAt() == null ? "" : b.getExpiresAt());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV", e);
        }
        return out.toString();
    }

    public List<BlockRegistry.BulkRequest> read(Reader reader) {
        List<BlockRegistry.BulkRequest> rows = new ArrayList<>();
        try (CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT
                .withIgnoreEmptyLines()
                .withTrim()
                .withIgnoreHeaderCase()
                .withFirstRecordAsHeader())) {

            for (String required : List.of("cidr", "source", "why")) {
                if (!parser.getHeaderMap().containsKey(required)) {
                    throw new InvalidBlockRequestException("bulk upload is missing the '" + required + "' column");
                }
            }

            for (CSVRecord record : parser) {
                String duration = optional(record, "duration");
                rows.add(new BlockRegistry.BulkRequest(
                        record.get("cidr"),
                        record.get("source"),
                        record.get("why"),
                        duration.isEmpty() ? null : parseDuration(duration, record.getRecordNumber()),
                        parseFlag(optional(record, "skip_whitelist"))));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bulk upload", e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new InvalidBlockRequestException("malformed bulk upload: " + e.getMessage());
        }
        return rows;
    }

    private static String optional(CSVRecord record, String column) {
        if (!record.isMapped(column) || !record.isSet(column)) return "";
        return record.get(column).trim();
    }

    private static Long parseDuration(String raw, long recordNumber) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new InvalidBlockRequestException("row " + recordNumber + ": duration '" + raw + "' is not a number of seconds");
        }
    }

    private static boolean parseFlag(String raw) {
        String v = raw.toLowerCase(Locale.ROOT);
        return v.equals("1") || v.equals("true") || v.equals("yes");
    }
}
