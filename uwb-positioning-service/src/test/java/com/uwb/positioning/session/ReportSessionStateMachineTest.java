package com.uwb.positioning.session;

import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.repository.ReportSessionEntity;
import com.uwb.positioning.repository.ReportSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Report Session State Machine Tests")
class ReportSessionStateMachineTest {

    private static final Instant NOW = Instant.parse("2025-03-14T10:15:30Z");

    @Mock
    private ReportSessionRepository sessionRepository;

    private ReportSessionStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        stateMachine = new ReportSessionStateMachine(
            sessionRepository, TransactionOperations.withoutTransaction(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CalibratedReading reading(int command, String user, Double spanX, Double spanY) {
        return new CalibratedReading("4", Collections.nCopies(8, null), Set.of(), spanX, spanY,
            command, user, NOW, 40.0, false);
    }

    private static ReportSessionEntity openSession(Long id, String user) {
        ReportSessionEntity session = new ReportSessionEntity();
        session.setId(id);
        session.setUser(user);
        session.setStartedAt(NOW.minusSeconds(600));
        return session;
    }

    @Nested
    @DisplayName("Open Command Tests")
    class OpenCommandTests {

        @Test
        @DisplayName("should create a session when the user has none open")
        void shouldOpenNewSession() {
            // Given
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice"))
                .thenReturn(Optional.empty());
            when(sessionRepository.save(any(ReportSessionEntity.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            SessionOutcome outcome = stateMachine.apply(reading(1, "alice", 112.75, 61.5));

            // Then
            assertEquals(SessionOutcome.OPENED, outcome);
            ArgumentCaptor<ReportSessionEntity> captor = ArgumentCaptor.forClass(ReportSessionEntity.class);
            verify(sessionRepository).save(captor.capture());
            ReportSessionEntity saved = captor.getValue();
            assertEquals("alice", saved.getUser());
            assertEquals(NOW, saved.getStartedAt());
            assertNull(saved.getEndedAt());
            assertEquals("112.75", saved.getKx());
            assertEquals(61.5, saved.getSpanY());
        }

        @Test
        @DisplayName("should update the open session in place instead of opening another")
        void shouldUpdateExistingSession() {
            // Given
            ReportSessionEntity existing = openSession(7L, "alice");
            existing.applySpanSnapshot(100.0, 50.0);
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice"))
                .thenReturn(Optional.of(existing));

            // When
            SessionOutcome outcome = stateMachine.apply(reading(1, "alice", 120.0, null));

            // Then
            assertEquals(SessionOutcome.UPDATED, outcome);
            verify(sessionRepository).save(existing);
            assertEquals(120.0, existing.getSpanX());
            assertEquals(50.0, existing.getSpanY());
            assertEquals(NOW.minusSeconds(600), existing.getStartedAt());
        }

        @Test
        @DisplayName("should backfill a missing start time on update")
        void shouldBackfillStartTime() {
            ReportSessionEntity existing = openSession(7L, "alice");
            existing.setStartedAt(null);
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice"))
                .thenReturn(Optional.of(existing));

            stateMachine.apply(reading(1, "alice", null, null));

            assertEquals(NOW, existing.getStartedAt());
        }
    }

    @Nested
    @DisplayName("Close Command Tests")
    class CloseCommandTests {

        @Test
        @DisplayName("should close the open session")
        void shouldCloseSession() {
            ReportSessionEntity existing = openSession(7L, "alice");
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice"))
                .thenReturn(Optional.of(existing));

            SessionOutcome outcome = stateMachine.apply(reading(3, "alice", null, null));

            assertEquals(SessionOutcome.CLOSED, outcome);
            assertEquals(NOW, existing.getEndedAt());
            assertFalse(existing.isOpen());
            verify(sessionRepository).save(existing);
        }

        @Test
        @DisplayName("should ignore a close without an open session")
        void shouldIgnoreCloseWithoutSession() {
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice"))
                .thenReturn(Optional.empty());

            SessionOutcome outcome = stateMachine.apply(reading(3, "alice", null, null));

            assertEquals(SessionOutcome.NONE, outcome);
            verify(sessionRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("No-Op Tests")
    class NoOpTests {

        @ParameterizedTest
        @ValueSource(ints = {0, 2, 4, 99, -1})
        @DisplayName("should not touch sessions for other command codes")
        void shouldIgnoreOtherCommands(int command) {
            assertEquals(SessionOutcome.NONE, stateMachine.apply(reading(command, "alice", 10.0, 10.0)));
            verifyNoInteractions(sessionRepository);
        }

        @Test
        @DisplayName("should not touch sessions without a user")
        void shouldIgnoreMissingUser() {
            assertEquals(SessionOutcome.NONE, stateMachine.apply(reading(1, null, 10.0, 10.0)));
            assertEquals(SessionOutcome.NONE, stateMachine.apply(reading(3, " ", 10.0, 10.0)));
            verifyNoInteractions(sessionRepository);
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("should keep a single open session when one user opens concurrently")
        void shouldSerialiseConcurrentOpens() throws Exception {
            // Given
            List<ReportSessionEntity> stored = new CopyOnWriteArrayList<>();
            AtomicLong ids = new AtomicLong();
            when(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc(anyString()))
                .thenAnswer(invocation -> {
                    String user = invocation.getArgument(0);
                    Thread.sleep(5);
                    return stored.stream()
                        .filter(session -> user.equals(session.getUser()) && session.isOpen())
                        .findFirst();
                });
            when(sessionRepository.save(any(ReportSessionEntity.class))).thenAnswer(invocation -> {
                ReportSessionEntity session = invocation.getArgument(0);
                if (session.getId() == null) {
                    session.setId(ids.incrementAndGet());
                    stored.add(session);
                }
                return session;
            });

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<SessionOutcome>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return stateMachine.apply(reading(1, "alice", 100.0, 50.0));
                    }));
                }

                // When
                start.countDown();
                int opened = 0;
                for (Future<SessionOutcome> future : futures) {
                    if (future.get(10, TimeUnit.SECONDS) == SessionOutcome.OPENED) {
                        opened++;
                    }
                }

                // Then
                assertEquals(1, opened);
                assertEquals(1, stored.size());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
