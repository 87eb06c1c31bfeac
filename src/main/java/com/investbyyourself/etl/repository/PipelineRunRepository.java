package com.investbyyourself.etl.repository;

import com.investbyyourself.etl.model.PipelineRun;
import com.investbyyourself.etl.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PipelineRunRepository extends JpaRepository<PipelineRun, UUID> {

    List<PipelineRun> findAllByStatus(RunStatus status);
}
