package com.batchanalytics.infrastructure.persistence.repository;

import com.batchanalytics.infrastructure.persistence.entity.AggregateResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AggregateResultRepository extends JpaRepository<AggregateResultEntity, Long> {
}
