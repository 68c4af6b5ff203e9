package inkwell.coordinator.agent;

import inkwell.coordinator.model.TaskMessage;

/**
 * Boundary to a concrete agent (research, writing, editing, ...).
 *
 * An adapter handles task messages addressed to its role and returns the value it produced.
 * It reads its inputs through the {@link AgentContext} and never talks to the scheduler:
 * storing the result and reporting completion is done by the {@link AgentWorker} driving it.
 * Throwing reports a failed attempt; the scheduler decides whether to retry.
 */
public interface AgentAdapter {

    /** Role this adapter consumes, e.g. "writer". */
    String role();

    AgentResult perform(TaskMessage task, AgentContext context) throws Exception;
}
