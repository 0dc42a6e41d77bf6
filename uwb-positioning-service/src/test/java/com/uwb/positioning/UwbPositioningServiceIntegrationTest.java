package com.uwb.positioning;

import com.uwb.positioning.dto.CalibratedReading;
import com.uwb.positioning.motion.MotionCache;
import com.uwb.positioning.repository.ProcessedPositionEntity;
import com.uwb.positioning.repository.ProcessedPositionRepository;
import com.uwb.positioning.repository.RawReadingEntity;
import com.uwb.positioning.repository.RawReadingRepository;
import com.uwb.positioning.repository.ReportSessionEntity;
import com.uwb.positioning.repository.ReportSessionRepository;
import com.uwb.positioning.session.ReportSessionStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests running the ingestion endpoints against the in-memory database.
 * Forwarding is disabled in the test profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("UWB Positioning Service Integration Tests")
class UwbPositioningServiceIntegrationTest {

    private static final String SAMPLE_LINE =
        "AT+RANGE=tid:4,mask:01,seq:218,range:(100,110,103,0,0,0,0,0),kx:152.75,ky:101.3,cmd:2,user:user1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RawReadingRepository rawReadingRepository;

    @Autowired
    private ProcessedPositionRepository processedPositionRepository;

    @Autowired
    private ReportSessionRepository sessionRepository;

    @Autowired
    private MotionCache motionCache;

    @Autowired
    private ReportSessionStateMachine sessionStateMachine;

    @BeforeEach
    void setUp() {
        rawReadingRepository.deleteAll();
        processedPositionRepository.deleteAll();
        sessionRepository.deleteAll();
        motionCache.clear();
    }

    private static String payload(String... lines) {
        return "{\"payload\":[\"" + String.join("\",\"", lines) + "\"]}";
    }

    private static String lineAt(String tag, double x, double y) {
        return String.format(Locale.ROOT, "tid:%s,range:(%s,%s,%s,%s),kx:140,ky:90,cmd:2",
            tag,
            Math.hypot(x, y) + 40,
            Math.hypot(x - 100, y) + 40,
            Math.hypot(x, y - 50) + 40,
            Math.hypot(x - 100, y - 50) + 40);
    }

    @Test
    @DisplayName("should store a calibrated raw reading")
    void shouldIngestRawReading() throws Exception {
        mockMvc.perform(post("/v1/uwb/raw-readings/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload(SAMPLE_LINE, "tid:62,range:(1,2,3)", "garbage")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.receivedLines", is(3)))
            .andExpect(jsonPath("$.saved", is(1)))
            .andExpect(jsonPath("$.skippedCalibration", is(1)))
            .andExpect(jsonPath("$.skippedInvalid", is(1)))
            .andExpect(jsonPath("$.forwardedOk", is(false)));

        List<RawReadingEntity> stored = rawReadingRepository.findAll();
        assertEquals(1, stored.size());
        RawReadingEntity reading = stored.get(0);
        assertEquals("4", reading.getTagNumber());
        assertEquals(60.0, reading.getDa0());
        assertEquals(-40.0, reading.getDa7());
        assertEquals(112.75, reading.getKx(), 1e-9);
        assertNotNull(reading.getCreatedAt());
    }

    @Test
    @DisplayName("should open and close a report session from inline commands")
    void shouldDriveReportSession() throws Exception {
        mockMvc.perform(post("/v1/uwb/raw-readings/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload(
                    "tid:4,range:(100,110,103),kx:150,ky:100,cmd:1,user:alice",
                    "tid:4,range:(100,110,103),kx:160,ky:100,cmd:1,user:alice")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sessionsOpenedOrUpdated", is(2)))
            .andExpect(jsonPath("$.saved", is(2)));

        List<ReportSessionEntity> sessions = sessionRepository.findAll();
        assertEquals(1, sessions.size());
        assertTrue(sessions.get(0).isOpen());
        assertEquals(120.0, sessions.get(0).getSpanX());

        mockMvc.perform(post("/v1/uwb/raw-readings/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload(
                    "tid:4,range:(100,110,103),cmd:3,user:alice",
                    "tid:4,range:(100,110,103),cmd:3,user:alice")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sessionsClosed", is(1)));

        ReportSessionEntity closed = sessionRepository.findAll().get(0);
        assertFalse(closed.isOpen());
        assertTrue(sessionRepository.findFirstByUserAndEndedAtIsNullOrderByIdDesc("alice").isEmpty());
    }

    @Test
    @DisplayName("should store solved positions with motion deltas")
    void shouldProcessPositions() throws Exception {
        mockMvc.perform(post("/v1/uwb/positions/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload(lineAt("9", 30, 20), lineAt("9", 33, 24))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.saved", is(2)))
            .andExpect(jsonPath("$.positions[0].distanceTravelled", nullValue()))
            .andExpect(jsonPath("$.positions[1].elapsedSeconds", is(0)));

        List<ProcessedPositionEntity> positions = processedPositionRepository.findAll();
        assertEquals(2, positions.size());
        assertTrue(positions.stream().anyMatch(p -> p.getDistanceTravelled() == null));
        assertTrue(positions.stream()
            .anyMatch(p -> p.getDistanceTravelled() != null && Math.abs(p.getDistanceTravelled() - 5.0) < 1e-6));
    }

    @Test
    @DisplayName("should reject an empty batch")
    void shouldRejectEmptyBatch() throws Exception {
        mockMvc.perform(post("/v1/uwb/positions/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"payload\":\" \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", is("Empty Batch")));

        assertEquals(0, processedPositionRepository.count());
    }

    @Test
    @DisplayName("should keep one open session per user under concurrent opens")
    void shouldSerialiseConcurrentSessionOpens() throws Exception {
        CalibratedReading open = new CalibratedReading("4", Collections.nCopies(8, null), Set.of(),
            110.0, 60.0, 1, "dana", Instant.now(), 40.0, false);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return sessionStateMachine.apply(open);
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<ReportSessionEntity> sessions = sessionRepository.findAll();
        assertEquals(1, sessions.size());
        assertTrue(sessions.get(0).isOpen());
    }
}
