package com.surveillance.engine.repository;

import com.surveillance.engine.entity.DetectionPattern;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for detections.
 *
 * Window queries filter on one coordinate axis only (latitude) plus the time floor,
 * matching what the document store can index. Callers post-filter longitude in memory.
 */
@Repository
public interface DetectionPatternRepository extends JpaRepository<DetectionPattern, String> {

    /**
     * Detections whose latitude lies in [minLatitude, maxLatitude] and that were
     * observed at or after {@code since}.
     */
    List<DetectionPattern> findByLatitudeBetweenAndDetectionTimestampGreaterThanEqual(
        double minLatitude,
        double maxLatitude,
        Instant since
    );

    long countByDetectionTimestampGreaterThanEqual(Instant since);
}
