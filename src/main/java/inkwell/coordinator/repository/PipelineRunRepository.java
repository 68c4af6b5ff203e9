package inkwell.coordinator.repository;

import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.model.RunStatus;

import java.util.List;
import java.util.Optional;

/**
 * Archive of pipeline runs and their per-stage status.
 */
public interface PipelineRunRepository {

    /**
     * Insert or replace the run row together with all its stage rows.
     */
    void save(PipelineRun run);

    Optional<PipelineRun> findById(String runId);

    List<PipelineRun> findByStatus(RunStatus status, int limit);

    /**
     * Most recent runs first.
     */
    List<PipelineRun> findRecent(int limit);
}
