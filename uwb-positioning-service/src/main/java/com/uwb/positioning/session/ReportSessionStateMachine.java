package com.uwb.positioning.session;

import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.repository.ReportSessionEntity;
import com.uwb.positioning.repository.ReportSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-user report session lifecycle driven by inline command codes.
 *
 * <pre>
 *            cmd:1 (create)            cmd:3
 *  Closed  ------------------>  Open  -------> Closed
 *                               |  ^
 *                               +--+ cmd:1 (update span, backfill start)
 * </pre>
 *
 * Transitions require a non-empty session user. Command 0 and unknown codes leave the session
 * untouched; whether the reading itself is stored is decided by the caller.
 *
 * <p>Transitions of one user are serialised on a striped lock that is held until the transition's
 * transaction has committed, so a concurrent open never misses a session created by another
 * request and at most one session per user is open. The lock is local to this process.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportSessionStateMachine {

    private static final int LOCK_STRIPES = 64;

    private final ReportSessionRepository sessionRepository;
    private final TransactionOperations transactionOperations;
    private final Clock clock;
    private final Lock[] userLocks = createLocks(LOCK_STRIPES);

    /**
     * Applies the reading's command to its user's session.
     *
     * @param reading calibrated reading carrying command and user
     * @return what happened to the session
     */
    public SessionOutcome apply(CalibratedReading reading) {
        if (!reading.hasSessionUser()) {
            return SessionOutcome.NONE;
        }

        SessionCommand command = SessionCommand.of(reading.command());
        if (command != SessionCommand.OPEN && command != SessionCommand.CLOSE) {
            return SessionOutcome.NONE;
        }

        String user = reading.sessionUser();
        Lock lock = lockFor(user);
        lock.lock();
        try {
            return transactionOperations.execute(status -> command == SessionCommand.OPEN
                ? open(user, reading.spanX(), reading.spanY())
                : close(user));
        } finally {
            lock.unlock();
        }
    }

    private SessionOutcome open(String user, Double spanX, Double spanY) {
        Instant now = clock.instant();
        Optional<ReportSessionEntity> existing =
            sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc(user);

        if (existing.isPresent()) {
            ReportSessionEntity session = existing.get();
            session.applySpanSnapshot(spanX, spanY);
            if (session.getStartedAt() == null) {
                session.setStartedAt(now);
            }
            sessionRepository.save(session);
            log.info("Updated open report session {} for user {}", session.getId(), user);
            return SessionOutcome.UPDATED;
        }

        ReportSessionEntity session = new ReportSessionEntity();
        session.setUser(user);
        session.setStartedAt(now);
        session.applySpanSnapshot(spanX, spanY);
        ReportSessionEntity saved = sessionRepository.save(session);
        log.info("Opened report session {} for user {}", saved.getId(), user);
        return SessionOutcome.OPENED;
    }

    private SessionOutcome close(String user) {
        Optional<ReportSessionEntity> existing =
            sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc(user);
        if (existing.isEmpty()) {
            log.debug("No open report session for user {}, close ignored", user);
            return SessionOutcome.NONE;
        }

        ReportSessionEntity session = existing.get();
        session.setEndedAt(clock.instant());
        sessionRepository.save(session);
        log.info("Closed report session {} for user {}", session.getId(), user);
        return SessionOutcome.CLOSED;
    }

    private Lock lockFor(String user) {
        return userLocks[Math.floorMod(user.hashCode(), userLocks.length)];
    }

    private static Lock[] createLocks(int count) {
        Lock[] locks = new Lock[count];
        for (int i = 0; i < count; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }
}
