package com.distributedsystems.bhr.service;

import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.repository.IWhitelistEntryRepository;
import com.distributedsystems.bhr.util.Network;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Answers whether a candidate network sits inside a protected network. Only the
 * "candidate inside entry" direction counts: a /16 request that merely overlaps a
 * whitelisted /32 is not a match.
 */
@Component
@RequiredArgsConstructor
public class WhitelistMatcher {

    private final IWhitelistEntryRepository whitelistRepository;

    public boolean isWhitelisted(Network network) {
        return findCovering(network).isPresent();
    }

    @Transactional(readOnly = true)
    public Optional<WhitelistEntryEntity> findCovering(Network network) {
        for (WhitelistEntryEntity entry : whitelistRepository.findAll()) {
            if (entry.getCidr().contains(network)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
