package inkwell.coordinator.pipeline;

import inkwell.coordinator.model.PipelineRun;
import inkwell.coordinator.model.StageReport;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Mutable state of one active run, owned by its control thread.
 * Other threads only read the latest snapshot or request an abort.
 */
final class RunContext {

    private final String runId;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile PipelineRun snapshot;
    private volatile boolean abortRequested = false;

    RunContext(PipelineRun initial) {
        this.runId = initial.runId();
        this.snapshot = initial;
    }

    String runId() {
        return runId;
    }

    PipelineRun snapshot() {
        return snapshot;
    }

    synchronized PipelineRun update(UnaryOperator<PipelineRun.Builder> change) {
        snapshot = change.apply(snapshot.toBuilder()).build();
        return snapshot;
    }

    synchronized PipelineRun stage(StageReport report) {
        return update(b -> b.stage(report));
    }

    /**
     * @return false if the run already reached a terminal status
     */
    synchronized boolean requestAbort() {
        if (snapshot.isTerminal()) {
            return false;
        }
        abortRequested = true;
        return true;
    }

    boolean abortRequested() {
        return abortRequested;
    }

    void markTerminated() {
        terminated.countDown();
    }

    boolean await(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
