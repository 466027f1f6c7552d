package com.distributedsystems.bhr.repository;

import com.distributedsystems.bhr.model.BlockEntity;
import com.distributedsystems.bhr.util.Network;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Block store plus the derived views. Every view query applies the same liveness
 * predicate (active and not past expiresAt) so an expired block that the sweeper has
 * not reached yet is never reported.
 */
@Repository
public interface IBlockRepository extends JpaRepository<BlockEntity, Long> {

    String LIVE = "b.active = true and (b.expiresAt is null or b.expiresAt > :now)";
    String CONFIRMED_BY_ANYONE =
            "exists (select c.id from AgentConfirmationEntity c where c.block = b and c.confirmedAt is not null)";
    String CONFIRMED_BY_AGENT =
            "exists (select c.id from AgentConfirmationEntity c where c.block = b and c.agentId = :agentId and c.confirmedAt is not null)";
    // A later block for the same network is live again, so the route must stay.
    String SUPERSEDED_BY_LIVE =
            "exists (select b2.id from BlockEntity b2 where b2.cidr = b.cidr and b2.active = true"
                    + " and (b2.expiresAt is null or b2.expiresAt > :now))";
    String ORDER = " order by b.createdAt asc, b.id asc";

    Optional<BlockEntity> findByActiveCidr(String activeCidr);

    Optional<BlockEntity> findFirstByCidrOrderByIdDesc(Network cidr);

    List<BlockEntity> findByCidrOrderByIdDesc(Network cidr);

    @Query("select b from BlockEntity b where " + LIVE + ORDER)
    List<BlockEntity> findExpected(@Param("now") Instant now);

    @Query("select b from BlockEntity b where " + LIVE + " and " + CONFIRMED_BY_ANYONE + ORDER)
    List<BlockEntity> findCurrent(@Param("now") Instant now);

    @Query("select b from BlockEntity b where " + LIVE + " and not " + CONFIRMED_BY_ANYONE + ORDER)
    List<BlockEntity> findPending(@Param("now") Instant now);

    @Query("select b from BlockEntity b where " + LIVE + " and not " + CONFIRMED_BY_AGENT + ORDER)
    List<BlockEntity> findQueue(@Param("now") Instant now, @Param("agentId") String agentId, Pageable page);

    @Query("select b from BlockEntity b where (b.active = false or (b.expiresAt is not null and b.expiresAt <= :now)) and "
            + CONFIRMED_BY_AGENT + " and not " + SUPERSEDED_BY_LIVE + ORDER)
    List<BlockEntity> findUnblockQueue(@Param("now") Instant now, @Param("agentId") String agentId, Pageable page);

    @Query("select b from BlockEntity b where b.active = true and b.expiresAt is not null and b.expiresAt <= :now" + ORDER)
    List<BlockEntity> findExpiredActive(@Param("now") Instant now);

    @Query("select count(b) from BlockEntity b where " + LIVE)
    long countExpected(@Param("now") Instant now);

    @Query("select count(b) from BlockEntity b where " + LIVE + " and " + CONFIRMED_BY_ANYONE)
    long countCurrent(@Param("now") Instant now);
}
