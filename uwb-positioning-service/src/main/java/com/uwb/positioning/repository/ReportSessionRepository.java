package com.uwb.positioning.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Storage of report sessions. At most one session per user is open at any time.
 */
@Repository
public interface ReportSessionRepository extends JpaRepository<ReportSessionEntity, Long> {

    /**
     * Finds the most recent open session of a user.
     */
    Optional<ReportSessionEntity> findFirstByUserAndEndedAtIsNullOrderByIdDesc(String user);
}
