package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.exception.InvalidBlockRequestException;
import com.distributedsystems.bhr.exception.NoSuchWhitelistEntryException;
import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.repository.IWhitelistEntryRepository;
import com.distributedsystems.bhr.util.Network;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WhitelistService {

    private final IWhitelistEntryRepository whitelistRepository;
    private final Clock clock;

    /**
     * Protects {@code cidr}. Adding a network that is already protected returns the
     * existing entry untouched.
     */
    public WhitelistEntryEntity add(String cidr, String who, String why) {
        Network network = Network.parse(cidr);
        if (why == null || why.isBlank()) {
            throw new InvalidBlockRequestException("a whitelist entry needs a reason");
        }
        var existing = whitelistRepository.findByCidr(network);
        if (existing.isPresent()) {
            log.debug("[whitelist] {} already protected by entry {}", network, existing.get().getId());
            return existing.get();
        }
        try {
            WhitelistEntryEntity saved = whitelistRepository.saveAndFlush(WhitelistEntryEntity.builder()
                    .cidr(network)
                    .who(who)
                    .why(why)
                    .createdAt(clock.instant())
                    .build());
            log.info("[whitelist] {} protected by {}: {}", network, who, why);
            return saved;
        } catch (DataIntegrityViolationException race) {
            return whitelistRepository.findByCidr(network).orElseThrow(() -> race);
        }
    }

    @Transactional(readOnly = true)
    public List<WhitelistEntryEntity> list() {
        return whitelistRepository.findAll().stream()
                .sorted(Comparator.comparing((WhitelistEntryEntity e) -> e.getCidr().toText()))
                .toList();
    }

    @Transactional
    public void remove(long entryId) {
        WhitelistEntryEntity entry = whitelistRepository.findById(entryId)
                .orElseThrow(() -> new NoSuchWhitelistEntryException(entryId));
        whitelistRepository.delete(entry);
        log.info("[whitelist] Entry {} for {} removed", entryId, entry.getCidr());
    }
}
