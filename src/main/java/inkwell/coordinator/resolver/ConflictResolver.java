package inkwell.coordinator.resolver;

import inkwell.coordinator.error.CoordinatorException;
import inkwell.coordinator.error.ResolutionConflictUnresolvableException;
import inkwell.coordinator.memory.MemoryKeys;
import inkwell.coordinator.memory.MemoryStore;
import inkwell.coordinator.model.Candidate;
import inkwell.coordinator.model.Destination;
import inkwell.coordinator.model.MemoryEntry;
import inkwell.coordinator.model.MemoryTier;
import inkwell.coordinator.model.ResolutionKind;
import inkwell.coordinator.model.ResolutionMessage;
import inkwell.coordinator.model.ResolutionOutcome;
import inkwell.coordinator.model.Stage;
import inkwell.coordinator.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Picks the authoritative value of a subject when several agents produced one.
 *
 * Policy, in order:
 * 1. a single acceptable candidate wins as is
 * 2. the configured merge strategy may combine all acceptable candidates
 * 3. otherwise the highest role rank wins
 * 4. equal ranks fall back to the most recent candidate, then the smallest task id
 *
 * The result is a pure function of the candidate set, so resolving the same set
 * again yields the same winner. The outcome is written to long-term memory under
 * {@link MemoryKeys#resolved(Stage, String)} and announced on the resolutions topic.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    /** Writer recorded for resolved values. */
    public static final String WRITER = "resolver";

    private final MemoryStore store;
    private final MessageQueue queue;
    private final ConflictRegistry registry;
    private final RolePriorityRanking ranking;
    private final MergeStrategy mergeStrategy;
    private final Clock clock;

    public ConflictResolver(MemoryStore store, MessageQueue queue, ConflictRegistry registry,
            RolePriorityRanking ranking, MergeStrategy mergeStrategy, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.registry = registry;
        this.ranking = ranking;
        this.mergeStrategy = mergeStrategy;
        this.clock = clock;
    }

    public ConflictRegistry registry() {
        return registry;
    }

    /**
     * Submit candidates and resolve in one step.
     */
    public ResolutionOutcome resolve(String runId, Stage stage, String subject, List<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            registry.submit(runId, stage, subject, candidate);
        }
        return resolve(runId, stage, subject);
    }

    /**
     * Resolve the open conflict record of a subject.
     * A record that is already resolved returns its stored outcome.
     *
     * @throws ResolutionConflictUnresolvableException if every candidate was rejected
     * @throws IllegalStateException                   if no candidate was ever submitted
     */
    public ResolutionOutcome resolve(String runId, Stage stage, String subject) {
        ConflictRecord record = registry.find(runId, stage, subject)
                .orElseThrow(() -> new IllegalStateException(
                        "No candidates for " + stage.key() + "/" + subject + " in run " + runId));

        record.lock().lock();
        try {
            if (record.status() == ConflictRecord.Status.RESOLVED) {
                return record.outcome();
            }

            List<Candidate> candidates = record.candidates();
            if (candidates.isEmpty()) {
                throw new IllegalStateException("Conflict record has no candidates: " + record);
            }

            List<Accepted> accepted = new ArrayList<>();
            List<String> rejectedRoles = new ArrayList<>();
            for (Candidate candidate : candidates) {
                int rank = ranking.rank(candidate.role(), subject);
                if (rank < 0) {
                    log.debug("Rejected {} for {}/{}: role rank {}", candidate.role(), stage.key(), subject, rank);
                    rejectedRoles.add(candidate.role());
                    continue;
                }
                Optional<MemoryEntry> value = store.get(runId, candidate.resultRef());
                if (value.isEmpty()) {
                    log.warn("Rejected {} for {}/{}: result {} not in memory", candidate.role(), stage.key(),
                            subject, candidate.resultRef());
                    rejectedRoles.add(candidate.role());
                    continue;
                }
                accepted.add(new Accepted(candidate, rank, value.get().value()));
            }

            if (accepted.isEmpty()) {
                String reason = "all " + candidates.size() + " candidates rejected";
                record.markUnresolvable(reason, clock.instant());
                log.warn("Unresolvable conflict {}/{} in run {}: {}", stage.key(), subject, runId, reason);
                throw new ResolutionConflictUnresolvableException(stage, subject, reason);
            }

            accepted.sort(RANKING_ORDER);
            ResolutionOutcome outcome = decide(runId, stage, subject, accepted, rejectedRoles);

            store.put(runId, outcome.resolvedRef(), outcome.value(), MemoryTier.LONG_TERM, WRITER);
            record.markResolved(outcome);
            log.info("Resolved {}/{} in run {}: {} by {} ({} candidates)", stage.key(), subject, runId,
                    outcome.kind(), outcome.winnerRole(), candidates.size());

            publish(runId, outcome);
            return outcome;
        } finally {
            record.lock().unlock();
        }
    }

    private ResolutionOutcome decide(String runId, Stage stage, String subject, List<Accepted> ranked,
            List<String> rejectedRoles) {
        Instant now = clock.instant();
        String resolvedRef = MemoryKeys.resolved(stage, subject);
        Accepted top = ranked.get(0);

        if (ranked.size() == 1) {
            return outcome(stage, subject, ResolutionKind.SINGLE, top, resolvedRef, top.value,
                    List.of(top.candidate.role()), rejectedRoles, now);
        }

        List<String> values = new ArrayList<>();
        LinkedHashSet<String> roles = new LinkedHashSet<>();
        for (Accepted a : ranked) {
            values.add(a.value);
            roles.add(a.candidate.role());
        }

        try {
            Optional<String> merged = mergeStrategy.merge(values);
            if (merged.isPresent()) {
                return outcome(stage, subject, ResolutionKind.MERGED, top, resolvedRef, merged.get(),
                        new ArrayList<>(roles), rejectedRoles, now);
            }
        } catch (MergeConflictException e) {
            log.debug("Merge of {}/{} in run {} failed, ranking instead: {}", stage.key(), subject, runId,
                    e.getMessage());
        }

        ResolutionKind kind = top.rank > ranked.get(1).rank ? ResolutionKind.PRIORITY : ResolutionKind.RECENCY;
        return outcome(stage, subject, kind, top, resolvedRef, top.value,
                List.of(top.candidate.role()), rejectedRoles, now);
    }

    private void publish(String runId, ResolutionOutcome outcome) {
        try {
            queue.enqueue(ResolutionMessage.of(runId, outcome), Destination.topic(Destination.RESOLUTIONS_TOPIC));
        } catch (CoordinatorException e) {
            // the value is already authoritative; listeners only miss the notification
            log.warn("Could not publish resolution of {}/{}: {}", outcome.stage().key(), outcome.subject(),
                    e.getMessage());
        }
    }

    private static ResolutionOutcome outcome(Stage stage, String subject, ResolutionKind kind, Accepted winner,
            String resolvedRef, String value, List<String> contributors, List<String> rejectedRoles, Instant now) {
        return new ResolutionOutcome(stage, subject, kind, winner.candidate.role(), winner.candidate.resultRef(),
                resolvedRef, value, contributors, rejectedRoles, now);
    }

    private static final Comparator<Accepted> RANKING_ORDER = Comparator
            .comparingInt((Accepted a) -> a.rank).reversed()
            .thenComparing((Accepted a) -> a.candidate.producedAt(), Comparator.reverseOrder())
            .thenComparing((Accepted a) -> a.candidate.taskId())
            .thenComparing((Accepted a) -> a.candidate.attempt(), Comparator.reverseOrder());

    private static final class Accepted {
        final Candidate candidate;
        final int rank;
        final String value;

        Accepted(Candidate candidate, int rank, String value) {
            this.candidate = candidate;
            this.rank = rank;
            this.value = value;
        }
    }
}
