package com.uwb.positioning.repository;

import com.uwb.positioning.dto.CalibratedReading;
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
import java.util.Arrays;
import java.util.List;

/**
 * Calibrated distance reading as stored, one column per anchor slot.
 */
@Entity
@Table(name = "uwb_raw_reading")
@Getter
@Setter
@NoArgsConstructor
@ToString
public class RawReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tag_number", nullable = false, length = 50)
    private String tagNumber;

    private Double da0;
    private Double da1;
    private Double da2;
    private Double da3;
    private Double da4;
    private Double da5;
    private Double da6;
    private Double da7;

    private Double kx;
    private Double ky;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static RawReadingEntity from(CalibratedReading reading) {
        RawReadingEntity entity = new RawReadingEntity();
        entity.setTagNumber(reading.tagId());
        entity.setDa0(reading.distance(0));
        entity.setDa1(reading.distance(1));
        entity.setDa2(reading.distance(2));
        entity.setDa3(reading.distance(3));
        entity.setDa4(reading.distance(4));
        entity.setDa5(reading.distance(5));
        entity.setDa6(reading.distance(6));
        entity.setDa7(reading.distance(7));
        entity.setKx(reading.spanX());
        entity.setKy(reading.spanY());
        entity.setCreatedAt(reading.capturedAt());
        return entity;
    }

    public List<Double> distances() {
        return Arrays.asList(da0, da1, da2, da3, da4, da5, da6, da7);
    }
}
