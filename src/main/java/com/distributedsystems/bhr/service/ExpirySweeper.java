package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.exe.BhrConfig;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.persistence.BlockLedger;
import com.distributedsystems.bhr.repository.IBlockRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Retires blocks whose duration has run out. Views already hide such blocks at read
 * time; the sweep makes the inactive flag durable and moves the block into agents'
 * unblock queues.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpirySweeper {

    private final IBlockRepository blockRepository;
    private final BlockLedger ledger;
    private final BhrConfig config;
    private final Clock clock;

    private ScheduledExecutorService scheduler;

    @PostConstruct
    void start() {
        BhrConfig.Expiry expiry = config.getExpiry();
        if (!expiry.isEnabled()) {
            log.info("[sweeper] Periodic expiry disabled; expired blocks are hidden at read time only");
            return;
        }
        long interval = Math.max(250L, expiry.getSweepIntervalMs());
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "bhr-expiry");
            t.setDaemon(true);
            return t;
        };
        scheduler = Executors.newSingleThreadScheduledExecutor(tf);
        scheduler.scheduleWithFixedDelay(this::runSweep, interval, interval, TimeUnit.MILLISECONDS);
        log.info("[sweeper] Expiry sweep armed every {}ms", interval);
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private void runSweep() {
        try {
            sweep(clock.instant());
        } catch (Exception e) {
            log.error("[sweeper] Expiry sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Deactivates every active block with {@code createdAt + duration <= now}.
     *
     * @return ids of the blocks this call expired
     */
    public List<Long> sweep(Instant now) {
        List<Long> expired = new ArrayList<>();
        for (BlockEntity block : blockRepository.findExpiredActive(now)) {
            synchronized (BlockLedger.networkLock(block.getCidr())) {
                try {
                    if (ledger.expire(block.getId(), now)) {
                        expired.add(block.getId());
                    }
                } catch (ConcurrencyFailureException e) {
                    log.debug("[sweeper] Block {} changed concurrently, next sweep re-checks it", block.getId());
                }
            }
        }
        if (!expired.isEmpty()) {
            log.info("[sweeper] Expired {} block(s): {}", expired.size(), expired);
        }
        return expired;
    }
}
