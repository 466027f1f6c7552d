package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exe.BhrConfig;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.repository.IAgentConfirmationRepository;
import com.distributedsystems.bhr.repository.IBlockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views derived from block and confirmation rows on every call. Nothing here
 * is cached, so the answer is always a function of the committed rows and the clock.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BlockViews {

    private final IBlockRepository blockRepository;
    private final IAgentConfirmationRepository confirmationRepository;
    private final BhrConfig config;
    private final Clock clock;

    /** Every live block, confirmed or not. */
    public List<BlockEntity> expected() {
        return blockRepository.findExpected(clock.instant());
    }

    /** Live blocks at least one agent has confirmed. */
    public List<BlockEntity> current() {
        return blockRepository.findCurrent(clock.instant());
    }

    /** Live blocks no agent has confirmed yet. */
    public List<BlockEntity> pending() {
        return blockRepository.findPending(clock.instant());
    }

    /**
     * Same as {@link #queue(String, Integer)} with no explicit limit: at most
     * {@code bhr.queue.default-limit} blocks come back (capped by
     * {@code bhr.queue.max-limit}). An agent keeps polling until the queue is empty.
     */
    public List<BlockEntity> queue(String agentId) {
        return queue(agentId, null);
    }

    /**
     * Live blocks {@code agentId} has never confirmed or has since unconfirmed, oldest
     * first.
     */
    public List<BlockEntity> queue(String agentId, Integer limit) {
        requireAgent(agentId);
        return blockRepository.findQueue(clock.instant(), agentId, PageRequest.of(0, effectiveLimit(limit)));
    }

    /**
     * Blocks that stopped being live while {@code agentId} still reports them applied.
     * A block whose network has been blocked again by a newer live block is left out.
     */
    public List<BlockEntity> unblockQueue(String agentId, Integer limit) {
        requireAgent(agentId);
        return blockRepository.findUnblockQueue(clock.instant(), agentId, PageRequest.of(0, effectiveLimit(limit)));
    }

    public BlockStats stats() {
        var now = clock.instant();
        long expected = blockRepository.countExpected(now);
        long current = blockRepository.countCurrent(now);
        Map<String, Long> perAgent = new LinkedHashMap<>();
        for (Object[] row : confirmationRepository.countLiveConfirmationsByAgent(now)) {
            perAgent.put((String) row[0], ((Number) row[1]).longValue());
        }
        return new BlockStats(expected, current, expected - current, perAgent);
    }

    public record BlockStats(long expected, long current, long pending, Map<String, Long> agents) {}

    private static void requireAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidBlockRequestException("agent identity is required");
        }
    }

    private int effectiveLimit(Integer requested) {
        int max = config.getQueue().getMaxLimit();
        if (requested == null || requested <= 0) {
            return Math.min(config.getQueue().getDefaultLimit(), max);
        }
        return Math.min(requested, max);
    }
}
