package com.uwb.positioning.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * A user-scoped report session. Open while {@code endedAt} is null.
 *
 * <p>The span snapshot columns are varchar in the report schema, so the values are stringified
 * here and nowhere else.
 */
@Entity
@Table(name = "uwb_report_session")
@Getter
@Setter
@NoArgsConstructor
@ToString
public class ReportSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_user", length = 100)
    private String user;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    private String kx;
    private String ky;

    public boolean isOpen() {
        return endedAt == null;
    }

    public Double getSpanX() {
        return toDouble(kx);
    }

    public Double getSpanY() {
        return toDouble(ky);
    }

    /**
     * Overwrites the span snapshot with the non-null values given.
     */
    public void applySpanSnapshot(Double spanX, Double spanY) {
        if (spanX != null) {
            this.kx = spanX.toString();
        }
        if (spanY != null) {
            this.ky = spanY.toString();
        }
    }

    private static Double toDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
