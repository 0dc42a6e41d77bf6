package com.uwb.positioning.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@DisplayName("Report Session Repository Tests")
class ReportSessionRepositoryTest {

    private static final Instant STARTED = Instant.parse("2025-03-14T09:00:00Z");

    @Autowired
    private ReportSessionRepository sessionRepository;

    private ReportSessionEntity session(String user, Instant endedAt) {
        ReportSessionEntity session = new ReportSessionEntity();
        session.setUser(user);
        session.setStartedAt(STARTED);
        session.setEndedAt(endedAt);
        session.applySpanSnapshot(112.75, 61.3);
        return sessionRepository.save(session);
    }

    @Test
    @DisplayName("should find the open session of a user")
    void shouldFindOpenSession() {
        session("alice", STARTED.plusSeconds(60));
        ReportSessionEntity open = session("alice", null);
        session("bob", null);

        Optional<ReportSessionEntity> found = sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice");

        assertTrue(found.isPresent());
        assertEquals(open.getId(), found.get().getId());
        assertTrue(found.get().isOpen());
    }

    @Test
    @DisplayName("should find nothing once every session is closed")
    void shouldIgnoreClosedSessions() {
        session("alice", STARTED.plusSeconds(60));

        assertTrue(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice").isEmpty());
        assertTrue(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("carol").isEmpty());
    }

    @Test
    @DisplayName("should keep the span snapshot as text")
    void shouldStoreSpanAsText() {
        ReportSessionEntity saved = session("alice", null);

        ReportSessionEntity reloaded = sessionRepository.findById(saved.getId()).orElseThrow();

        assertEquals("112.75", reloaded.getKx());
        assertEquals("61.3", reloaded.getKy());
        assertEquals(61.3, reloaded.getSpanY());
    }
}
