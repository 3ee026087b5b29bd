package com.batchanalytics.infrastructure.persistence.repository;

import com.batchanalytics.infrastructure.persistence.entity.RuleDefinitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RuleDefinitionRepository extends JpaRepository<RuleDefinitionEntity, String> {

    List<RuleDefinitionEntity> findByEnabledTrueOrderByRuleIdAsc();
}
