package com.surveillance.engine.repository;

import com.surveillance.engine.entity.TrainingTrigger;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TrainingTriggerRepository extends JpaRepository<TrainingTrigger, String> {

    /**
     * Newest triggers first; the page size bounds the result.
     */
    List<TrainingTrigger> findByOrderByCreatedAtDesc(Pageable pageable);

    List<TrainingTrigger> findByModelTypeOrderByCreatedAtDesc(String modelType);
}
