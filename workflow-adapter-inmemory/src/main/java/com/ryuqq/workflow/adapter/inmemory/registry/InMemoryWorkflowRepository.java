package com.ryuqq.workflow.adapter.inmemory.registry;

import com.ryuqq.workflow.core.model.WorkflowId;
import com.ryuqq.workflow.core.model.WorkflowState;
import com.ryuqq.workflow.core.spi.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link WorkflowRepository} SPI.
 *
 * <p>Live workflows are kept in a {@link ConcurrentHashMap} keyed by {@link WorkflowId}, so
 * registration and status listing can race safely. Lookups never create entries.</p>
 *
 * <p><strong>Retention:</strong></p>
 * <ul>
 *   <li>Unbounded by default (states live until process exit)</li>
 *   <li>With a bounded {@link RetentionPolicy}, registration evicts the oldest completed
 *       workflows once the cap is exceeded</li>
 *   <li>Running and paused workflows are never evicted, so the cap is a soft limit</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowRepository.class);

    private static final Comparator<WorkflowState> BY_START_TIME =
        Comparator.comparing(WorkflowState::getStartTime)
            .thenComparing(state -> state.getId().getValue());

    private final ConcurrentHashMap<WorkflowId, WorkflowState> workflows = new ConcurrentHashMap<>();
    private final RetentionPolicy retentionPolicy;
    private final Object evictionLock = new Object();

    /**
     * Creates an unbounded repository.
     */
    public InMemoryWorkflowRepository() {
        this(new RetentionPolicy());
    }

    /**
     * Creates a repository with the given retention policy.
     *
     * @param retentionPolicy the retention policy
     * @throws IllegalArgumentException if retentionPolicy is null
     */
    public InMemoryWorkflowRepository(RetentionPolicy retentionPolicy) {
        if (retentionPolicy == null) {
            throw new IllegalArgumentException("retentionPolicy cannot be null");
        }
        this.retentionPolicy = retentionPolicy;
    }

    @Override
    public void register(WorkflowState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        WorkflowState existing = workflows.putIfAbsent(state.getId(), state);
        if (existing != null) {
            throw new IllegalStateException("Workflow already registered: " + state.getId());
        }
        if (retentionPolicy.isBounded()) {
            evictCompleted();
        }
    }

    @Override
    public Optional<WorkflowState> find(WorkflowId workflowId) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId cannot be null");
        }
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public Collection<WorkflowState> findAll() {
        return workflows.values().stream()
            .sorted(BY_START_TIME)
            .collect(Collectors.toList());
    }

    @Override
    public int size() {
        return workflows.size();
    }

    /**
     * Removes every workflow. Intended for tests.
     */
    public void clear() {
        workflows.clear();
    }

    private void evictCompleted() {
        synchronized (evictionLock) {
            int excess = workflows.size() - retentionPolicy.maxRetainedWorkflows();
            if (excess <= 0) {
                return;
            }
            List<WorkflowState> candidates = workflows.values().stream()
                .filter(state -> state.getStatus().isTerminal())
                .sorted(BY_START_TIME)
                .limit(excess)
                .collect(Collectors.toList());
            for (WorkflowState state : candidates) {
                workflows.remove(state.getId(), state);
                log.debug("Evicted completed workflow: id={}, status={}", state.getId(), state.getStatus());
            }
            if (candidates.size() < excess) {
                log.warn("Retention cap exceeded by active workflows: size={}, cap={}",
                    workflows.size(), retentionPolicy.maxRetainedWorkflows());
            }
        }
    }
}
