package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.exception.BhrException;
import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exception.NoSuchActiveBlockException;
import com.distributedsystems.bhr.exception.NoSuchBlockException;
import com.distributedsystems.bhr.exception.WhitelistConflictException;
import com.distributedsystems.bhr.exe.BhrConfig;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.persistence.BlockLedger;
import com.distributedsystems.bhr.repository.IBlockRepository;
import com.distributedsystems.bhr.util.Network;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Owns the block and confirmation lifecycles.
 *
 * <p>Writers for one network serialize on {@link BlockLedger#networkLock}, and writers
 * for one (block, agent) pair on {@link BlockLedger#confirmationLock}; each monitor is
 * held until the ledger transaction has committed. The unique constraints on the
 * active network and on (block, agent) cover writers in other processes: a lost
 * create race resolves to the winner's block and a lost confirmation race is retried.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockRegistry {

    private static final int MAX_AGENT_ID_LENGTH = 128;
    private static final int MAX_CREATE_ATTEMPTS = 3;

    private final BlockLedger ledger;
    private final IBlockRepository blockRepository;
    private final WhitelistMatcher whitelistMatcher;
    private final BhrConfig config;
    private final Clock clock;

    public record AddOutcome(BlockEntity block, boolean created) {}

    public BlockEntity addBlock(String network, String requestedBy, String source, String reason) {
        return addBlock(network, requestedBy, source, reason, null, false);
    }

    public BlockEntity addBlock(String network, String requestedBy, String source, String reason,
                                Duration duration, boolean skipWhitelist) {
        return add(Network.parse(network), requestedBy, source, reason, duration, skipWhitelist).block();
    }

    /**
     * Creates a block for {@code network} unless an active one exists, in which case the
     * existing block is returned as is: no field update, no confirmation reset.
     *
     * @throws WhitelistConflictException when a protected network covers the request and
     *                                    {@code skipWhitelist} is false
     */
    public AddOutcome add(Network network, String requestedBy, String source, String reason,
                          Duration duration, boolean skipWhitelist) {
        validateRequest(requestedBy, source, reason, duration);
        validateExpiry(duration, clock.instant());

        synchronized (BlockLedger.networkLock(network)) {
            for (int attempt = 1; ; attempt++) {
                Instant now = clock.instant();
                ledger.retireIfExpired(network, now);

                Optional<BlockEntity> existing = ledger.findActive(network);
                if (existing.isPresent()) {
                    log.debug("[registry] {} already blocked by block {}", network, existing.get().getId());
                    return new AddOutcome(existing.get(), false);
                }

                if (!skipWhitelist) {
                    Optional<WhitelistEntryEntity> covering = whitelistMatcher.findCovering(network);
                    if (covering.isPresent()) {
                        WhitelistEntryEntity entry = covering.get();
                        log.warn("[registry] Block of {} requested by {} rejected: whitelisted by {} ({})",
                                network, requestedBy, entry.getCidr(), entry.getWhy());
                        throw new WhitelistConflictException(network.toText(), entry.getCidr().toText(), entry.getWhy());
                    }
                }

                try {
                    return new AddOutcome(ledger.insert(draft(network, requestedBy, source, reason, duration, skipWhitelist, now)), true);
                } catch (DataIntegrityViolationException race) {
                    // Another process created the active block between our read and insert.
                    Optional<BlockEntity> winner = ledger.findActive(network);
                    if (winner.isPresent()) {
                        log.debug("[registry] Lost create race for {}, returning block {}", network, winner.get().getId());
                        return new AddOutcome(winner.get(), false);
                    }
                    if (attempt >= MAX_CREATE_ATTEMPTS) {
                        throw race;
                    }
                }
            }
        }
    }

    /**
     * Creates each row independently; one bad row does not stop the rest.
     */
    public List<BulkResult> addBlocks(List<BulkRequest> requests, String requestedBy) {
        List<BulkResult> results = new ArrayList<>(requests.size());
        for (BulkRequest request : requests) {
            try {
                Duration duration = request.durationSeconds() == null ? null : Duration.ofSeconds(request.durationSeconds());
                AddOutcome outcome = add(Network.parse(request.cidr()), requestedBy, request.source(), request.reason(),
                        duration, request.skipWhitelist());
                results.add(new BulkResult(request.cidr(), outcome.created() ? BulkStatus.CREATED : BulkStatus.EXISTING,
                        outcome.block().getId(), null));
            } catch (BhrException e) {
                results.add(new BulkResult(request.cidr(), BulkStatus.REJECTED, null, e.getCode() + ": " + e.getMessage()));
            }
        }
        log.info("[registry] Bulk add by {}: {} rows, {} created", requestedBy, results.size(),
                results.stream().filter(r -> r.status() == BulkStatus.CREATED).count());
        return results;
    }

    public record BulkRequest(String cidr, String source, String reason, Long durationSeconds, boolean skipWhitelist) {}

    public enum BulkStatus { CREATED, EXISTING, REJECTED }

    public record BulkResult(String cidr, BulkStatus status, Long blockId, String error) {}

    public void setBlocked(String network, String agentId) {
        setBlocked(Network.parse(network), agentId);
    }

    /**
     * Records that {@code agentId} has applied the active block of {@code network}.
     * Repeating the call only refreshes {@code confirmedAt}.
     */
    public void setBlocked(Network network, String agentId) {
        validateAgent(agentId);
        BlockEntity block = requireLive(network);
        confirm(block.getId(), agentId);
    }

    public void setBlocked(long blockId, String agentId) {
        validateAgent(agentId);
        confirm(requireLive(blockId).getId(), agentId);
    }

    public void setUnblocked(String network, String agentId) {
        setUnblocked(Network.parse(network), agentId);
    }

    /**
     * Clears the agent's confirmation so the block re-enters its queue. The block itself
     * stays active.
     */
    public void setUnblocked(Network network, String agentId) {
        validateAgent(agentId);
        BlockEntity block = requireLive(network);
        unconfirm(block.getId(), agentId);
    }

    public void setUnblocked(long blockId, String agentId) {
        validateAgent(agentId);
        unconfirm(requireLive(blockId).getId(), agentId);
    }

    public void acknowledgeRemoval(long blockId, String agentId) {
        validateAgent(agentId);
        synchronized (BlockLedger.confirmationLock(blockId, agentId)) {
            withRetry("acknowledgeRemoval(" + blockId + ", " + agentId + ")",
                    () -> ledger.acknowledgeRemoval(blockId, agentId, clock.instant()));
        }
    }

    /**
     * Exact lookup among all blocks, live or not. When the network has history the active
     * block wins, otherwise the most recently created one is returned.
     */
    @Transactional(readOnly = true)
    public Optional<BlockEntity> getBlock(String network) {
        return getBlock(Network.parse(network));
    }

    @Transactional(readOnly = true)
    public Optional<BlockEntity> getBlock(Network network) {
        Optional<BlockEntity> active = blockRepository.findByActiveCidr(network.toText());
        return active.isPresent() ? active : blockRepository.findFirstByCidrOrderByIdDesc(network);
    }

    @Transactional(readOnly = true)
    public BlockEntity getBlockById(long blockId) {
        return blockRepository.findById(blockId).orElseThrow(() -> new NoSuchBlockException(blockId));
    }

    @Transactional(readOnly = true)
    public List<BlockEntity> history(String network) {
        return blockRepository.findByCidrOrderByIdDesc(Network.parse(network));
    }

    public void withdraw(long blockId) {
        withdraw(blockId, null, null);
    }

    /**
     * Administrative removal. Confirmations stay for audit; withdrawing an inactive block
     * does nothing.
     */
    public void withdraw(long blockId, String who, String why) {
        BlockEntity block = getBlockById(blockId);
        synchronized (BlockLedger.networkLock(block.getCidr())) {
            withRetry("withdraw(" + blockId + ")", () -> ledger.withdraw(blockId, who, why, clock.instant()));
        }
    }

    private void confirm(long blockId, String agentId) {
        synchronized (BlockLedger.confirmationLock(blockId, agentId)) {
            withRetry("setBlocked(" + blockId + ", " + agentId + ")",
                    () -> ledger.confirm(blockId, agentId, clock.instant()));
        }
    }

    private void unconfirm(long blockId, String agentId) {
        synchronized (BlockLedger.confirmationLock(blockId, agentId)) {
            withRetry("setUnblocked(" + blockId + ", " + agentId + ")",
                    () -> ledger.unconfirm(blockId, agentId, clock.instant()));
        }
    }

    private BlockEntity requireLive(Network network) {
        return ledger.findLive(network, clock.instant())
                .orElseThrow(() -> new NoSuchActiveBlockException(network.toText()));
    }

    private BlockEntity requireLive(long blockId) {
        Instant now = clock.instant();
        return blockRepository.findById(blockId)
                .filter(b -> b.isLiveAt(now))
                .orElseThrow(() -> new NoSuchActiveBlockException("block " + blockId));
    }

    private <T> T withRetry(String what, Supplier<T> action) {
        int maxRetries = config.getConfirmation().getMaxRetries();
        long baseBackoffMs = config.getConfirmation().getBackoffMs();
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (++attempt > maxRetries) {
                    log.warn("[registry] {} gave up after {} attempts: {}", what, attempt, e.getMessage());
                    throw e;
                }
                long backoff = baseBackoffMs * (1L << (attempt - 1));
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private static BlockEntity draft(Network network, String requestedBy, String source, String reason,
                                     Duration duration, boolean skipWhitelist, Instant now) {
        return BlockEntity.builder()
                .cidr(network)
                .activeCidr(network.toText())
                .requestedBy(requestedBy)
                .source(source.trim())
                .reason(reason.trim())
                .createdAt(now)
                .durationSeconds(duration == null ? null : duration.getSeconds())
                .expiresAt(duration == null ? null : now.plus(duration))
                .skipWhitelist(skipWhitelist)
                .active(true)
                .build();
    }

    private static void validateRequest(String requestedBy, String source, String reason, Duration duration) {
        if (requestedBy == null || requestedBy.isBlank()) {
            throw new InvalidBlockRequestException("requesting principal is required");
        }
        if (requestedBy.length() > 128) {
            throw new InvalidBlockRequestException("requesting principal longer than 128 characters");
        }
        if (source == null || source.isBlank()) {
            throw new InvalidBlockRequestException("source is required");
        }
        if (source.trim().length() > 255) {
            throw new InvalidBlockRequestException("source longer than 255 characters");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidBlockRequestException("reason is required");
        }
        if (reason.trim().length() > 1024) {
            throw new InvalidBlockRequestException("reason longer than 1024 characters");
        }
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new InvalidBlockRequestException("duration must be positive, got " + duration.getSeconds() + "s");
        }
    }

    private static void validateExpiry(Duration duration, Instant now) {
        if (duration == null) {
            return;
        }
        try {
            now.plus(duration);
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidBlockRequestException("duration of " + duration.getSeconds() + "s is too long");
        }
    }

    private static void validateAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidBlockRequestException("agent identity is required");
        }
        if (agentId.length() > MAX_AGENT_ID_LENGTH) {
            throw new InvalidBlockRequestException("agent identity longer than " + MAX_AGENT_ID_LENGTH + " characters");
        }
    }
}
