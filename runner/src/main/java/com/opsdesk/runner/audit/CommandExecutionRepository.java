package com.opsdesk.runner.audit;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Access to the command_executions audit table.
 */
public interface CommandExecutionRepository extends JpaRepository<CommandExecution, Long> {

    List<CommandExecution> findAllByOrderByStartedAtDesc(Pageable page);

    long countByCreatedAtBefore(Instant cutoff);

    /** Bulk delete; returns the number of rows removed. */
    @Modifying
    @Query("DELETE FROM CommandExecution e WHERE e.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
