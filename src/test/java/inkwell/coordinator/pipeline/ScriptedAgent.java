package inkwell.coordinator.pipeline;

import inkwell.coordinator.agent.AgentAdapter;
import inkwell.coordinator.agent.AgentContext;
import inkwell.coordinator.agent.AgentResult;
import inkwell.coordinator.model.TaskMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test adapter whose behaviour is a lambda; remembers every task it was handed.
 */
final class ScriptedAgent implements AgentAdapter {

    @FunctionalInterface
    interface Script {
        AgentResult run(TaskMessage task, AgentContext context) throws Exception;
    }

    private final String role;
    private final Script script;
    private final List<TaskMessage> received = new CopyOnWriteArrayList<>();

    ScriptedAgent(String role, Script script) {
        this.role = role;
        this.script = script;
    }

    /** Answers every task with "role:subject". */
    static ScriptedAgent echo(String role) {
        return new ScriptedAgent(role, (task, ctx) -> AgentResult.complete(role + ":" + task.subject()));
    }

    @Override
    public String role() {
        return role;
    }

    @Override
    public AgentResult perform(TaskMessage task, AgentContext context) throws Exception {
        received.add(task);
        return script.run(task, context);
    }

    List<TaskMessage> received() {
        return received;
    }
}
