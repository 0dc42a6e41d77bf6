package com.uwb.positioning.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RawReadingRepository extends JpaRepository<RawReadingEntity, Long> {
}
