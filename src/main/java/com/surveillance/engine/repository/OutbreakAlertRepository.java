package com.surveillance.engine.repository;

import com.surveillance.engine.entity.AlertStatus;
import com.surveillance.engine.entity.OutbreakAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface OutbreakAlertRepository extends JpaRepository<OutbreakAlert, String> {

    long countByStatus(AlertStatus status);

    List<OutbreakAlert> findByStatusOrderByAlertTimestampDesc(AlertStatus status);

    /**
     * Whether an alert with the given status was raised inside the box since the cutoff.
     * Used to suppress repeat alerts for a cluster that is already flagged.
     */
    @Query("""
        SELECT COUNT(a) > 0 FROM OutbreakAlert a
        WHERE a.status = :status
        AND a.latitude BETWEEN :minLatitude AND :maxLatitude
        AND a.longitude BETWEEN :minLongitude AND :maxLongitude
        AND a.alertTimestamp >= :since
        """)
    boolean existsInArea(
        @Param("status") AlertStatus status,
        @Param("minLatitude") double minLatitude,
        @Param("maxLatitude") double maxLatitude,
        @Param("minLongitude") double minLongitude,
        @Param("maxLongitude") double maxLongitude,
        @Param("since") Instant since
    );
}
