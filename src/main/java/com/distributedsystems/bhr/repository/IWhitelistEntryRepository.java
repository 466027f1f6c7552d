package com.distributedsystems.bhr.repository;

import com.distributedsystems.bhr.model.WhitelistEntryEntity;
import com.distributedsystems.bhr.util.Network;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IWhitelistEntryRepository extends JpaRepository<WhitelistEntryEntity, Long> {
    Optional<WhitelistEntryEntity> findByCidr(Network cidr);
}
