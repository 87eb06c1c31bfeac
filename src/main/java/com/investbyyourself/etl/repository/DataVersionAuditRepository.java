package com.investbyyourself.etl.repository;

import com.investbyyourself.etl.model.DataVersionAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DataVersionAuditRepository extends JpaRepository<DataVersionAudit, UUID> {

    /**
     * Version history of one scope, newest first, across all backends.
     */
    List<DataVersionAudit> findAllByDatasetAndScopeKeyOrderByCreatedAtDesc(String dataset, String scopeKey);
}
