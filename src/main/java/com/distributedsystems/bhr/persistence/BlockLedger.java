package com.distributedsystems.bhr.persistence;

import com.distributedsystems.bhr.exception.BlockStillActiveException;
import com.distributedsystems.bhr.exception.NoSuchActiveBlockException;
import com.distributedsystems.bhr.exception.NoSuchBlockException;
import com.distributedsystems.bhr.model.AgentConfirmationEntity;
import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.repository.IAgentConfirmationRepository;
import com.distributedsystems.bhr.repository.IBlockRepository;
import com.distributedsystems.bhr.util.Network;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Single-transaction mutations of block and confirmation rows. Each public method
 * commits on its own so callers can hold a per-key monitor across the commit and
 * retry a whole unit when the database reports a conflict.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockLedger {

    private final IBlockRepository blockRepository;
    private final IAgentConfirmationRepository confirmationRepository;

    /** Monitor shared by every writer that touches the active block of one network. */
    public static Object networkLock(Network network) {
        return ("BHR_NET_" + network.toText()).intern();
    }

    /** Monitor for one (block, agent) confirmation row. */
    public static Object confirmationLock(long blockId, String agentId) {
        return ("BHR_CONF_" + blockId + "_" + agentId).intern();
    }

    @Transactional(readOnly = true)
    public Optional<BlockEntity> findActive(Network network) {
        return blockRepository.findByActiveCidr(network.toText());
    }

    @Transactional(readOnly = true)
    public Optional<BlockEntity> findLive(Network network, Instant now) {
        return blockRepository.findByActiveCidr(network.toText())
                .filter(b -> b.isLiveAt(now));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public BlockEntity insert(BlockEntity draft) {
        BlockEntity saved = blockRepository.saveAndFlush(draft);
        log.info("[ledger] Block {} created for {} by {} (source={}, expiresAt={}, skipWhitelist={})",
                saved.getId(), saved.getCidr(), saved.getRequestedBy(), saved.getSource(),
                saved.getExpiresAt(), saved.isSkipWhitelist());
        return saved;
    }

    /**
     * Marks the active block of {@code network} expired if its time is up.
     *
     * @return the id of the block that was retired, if any
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Long> retireIfExpired(Network network, Instant now) {
        Optional<BlockEntity> opt = blockRepository.findByActiveCidr(network.toText());
        if (opt.isEmpty() || !opt.get().hasExpiredBy(now)) {
            return Optional.empty();
        }
        BlockEntity block = opt.get();
        block.deactivate(now, null, BlockEntity.DeactivationReason.EXPIRED);
        blockRepository.saveAndFlush(block);
        log.info("[ledger] Block {} for {} expired (expiresAt={})", block.getId(), block.getCidr(), block.getExpiresAt());
        return Optional.of(block.getId());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean expire(long blockId, Instant now) {
        BlockEntity block = blockRepository.findById(blockId).orElse(null);
        if (block == null || !block.isActive() || !block.hasExpiredBy(now)) {
            return false;
        }
        block.deactivate(now, null, BlockEntity.DeactivationReason.EXPIRED);
        blockRepository.saveAndFlush(block);
        log.info("[ledger] Block {} for {} expired (expiresAt={})", block.getId(), block.getCidr(), block.getExpiresAt());
        return true;
    }

    /**
     * @return false when the block was already inactive
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean withdraw(long blockId, String who, String why, Instant now) {
        BlockEntity block = blockRepository.findById(blockId)
                .orElseThrow(() -> new NoSuchBlockException(blockId));
        if (!block.isActive()) {
            log.debug("[ledger] Withdraw of block {} ignored, already inactive ({})", blockId, block.getDeactivationReason());
            return false;
        }
        block.deactivate(now, who, BlockEntity.DeactivationReason.WITHDRAWN);
        block.setWithdrawReason(why);
        blockRepository.saveAndFlush(block);
        log.info("[ledger] Block {} for {} withdrawn by {}: {}", blockId, block.getCidr(), who, why);
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AgentConfirmationEntity confirm(long blockId, String agentId, Instant now) {
        BlockEntity block = requireLive(blockId, now);
        AgentConfirmationEntity conf = confirmationRepository.findByBlock_IdAndAgentId(blockId, agentId)
                .orElseGet(() -> AgentConfirmationEntity.builder()
                        .block(block)
                        .agentId(agentId)
                        .build());
        boolean firstForAgent = conf.getFirstConfirmedAt() == null;
        conf.setConfirmedAt(now);
        if (firstForAgent) {
            conf.setFirstConfirmedAt(now);
        }
        AgentConfirmationEntity saved = confirmationRepository.saveAndFlush(conf);
        log.info("[ledger] {} confirmed block {} ({}){}", agentId, blockId, block.getCidr(),
                firstForAgent ? "" : " again");
        return saved;
    }

    /**
     * Clears the agent's confirmation of a live block. Missing rows are left missing.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean unconfirm(long blockId, String agentId, Instant now) {
        BlockEntity block = requireLive(blockId, now);
        return clearConfirmation(block, agentId, now);
    }

    /**
     * An agent reports it removed the route of a block that is no longer live.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean acknowledgeRemoval(long blockId, String agentId, Instant now) {
        BlockEntity block = blockRepository.findById(blockId)
                .orElseThrow(() -> new NoSuchBlockException(blockId));
        if (block.isLiveAt(now)) {
            throw new BlockStillActiveException(blockId, block.getCidr().toText());
        }
        return clearConfirmation(block, agentId, now);
    }

    private boolean clearConfirmation(BlockEntity block, String agentId, Instant now) {
        Optional<AgentConfirmationEntity> opt = confirmationRepository.findByBlock_IdAndAgentId(block.getId(), agentId);
        if (opt.isEmpty() || !opt.get().isConfirmed()) {
            log.debug("[ledger] {} has no confirmation on block {} to clear", agentId, block.getId());
            return false;
        }
        AgentConfirmationEntity conf = opt.get();
        conf.setConfirmedAt(null);
        conf.setLastUnconfirmedAt(now);
        confirmationRepository.saveAndFlush(conf);
        log.info("[ledger] {} cleared its confirmation of block {} ({})", agentId, block.getId(), block.getCidr());
        return true;
    }

    private BlockEntity requireLive(long blockId, Instant now) {
        return blockRepository.findById(blockId)
                .filter(b -> b.isLiveAt(now))
                .orElseThrow(() -> new NoSuchActiveBlockException("block " + blockId));
    }
}
