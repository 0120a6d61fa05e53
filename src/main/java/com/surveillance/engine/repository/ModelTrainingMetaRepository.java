package com.surveillance.engine.repository;

import com.surveillance.engine.entity.ModelTrainingMeta;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ModelTrainingMetaRepository extends JpaRepository<ModelTrainingMeta, String> {

    /**
     * Reads the counter and write-locks its row until the surrounding transaction ends.
     * Waits at most 5s for a competing writer.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT m FROM ModelTrainingMeta m WHERE m.modelType = :modelType")
    Optional<ModelTrainingMeta> findForUpdate(@Param("modelType") String modelType);
}
