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
 * Resolved tag position with the movement since the tag's previous fix.
 * {@code distanceTravelled} and {@code elapsedSeconds} are null on a tag's first fix.
 */
@Entity
@Table(name = "uwb_processed_position")
@Getter
@Setter
@NoArgsConstructor
@ToString
public class ProcessedPositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tag_number", nullable = false, length = 50)
    private String tagNumber;

    private Double x;
    private Double y;

    @Column(name = "distance_travelled")
    private Double distanceTravelled;

    @Column(name = "elapsed_seconds")
    private Long elapsedSeconds;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
