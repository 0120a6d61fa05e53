package com.surveillance.engine.repository;

import com.surveillance.engine.entity.SystemStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SystemStatusRepository extends JpaRepository<SystemStatus, String> {
}
