package com.distributedsystems.bhr.repository;

import com.distributedsystems.bhr.model.AgentConfirmationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface IAgentConfirmationRepository extends JpaRepository<AgentConfirmationEntity, Long> {

    Optional<AgentConfirmationEntity> findByBlock_IdAndAgentId(Long blockId, String agentId);

    List<AgentConfirmationEntity> findByBlock_IdOrderByAgentIdAsc(Long blockId);

    @Query("select c.agentId, count(c) from AgentConfirmationEntity c join c.block b "
            + "where c.confirmedAt is not null and b.active = true and (b.expiresAt is null or b.expiresAt > :now) "
            + "group by c.agentId order by c.agentId")
    List<Object[]> countLiveConfirmationsByAgent(@Param("now") Instant now);
}
