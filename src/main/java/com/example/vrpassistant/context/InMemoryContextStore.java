package com.example.vrpassistant.context;

import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * {@link ContextStore} backed by a plain map behind one coarse lock.
 * <p>
 * Every operation holds the lock for its whole critical section, so no caller ever observes
 * a half-applied write. Stored {@link SessionContext} values are immutable and are handed
 * out directly as snapshots.
 * </p>
 */
@Component
public class InMemoryContextStore implements ContextStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryContextStore.class);

    private final Map<String, SessionContext> contexts = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryContextStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String sessionId, VrpProblem problem, VrpSolution solution) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (problem == null) {
            throw new IllegalArgumentException("problem is required for session " + sessionId);
        }

        int total = withLock(() -> {
            contexts.put(sessionId, SessionContext.builder()
                    .sessionId(sessionId)
                    .problem(problem)
                    .solution(solution)
                    .updatedAt(clock.instant())
                    .build());
            return contexts.size();
        });

        logger.info("Saved VRP context for session {} (jobs={}, resources={}, solution={}, sessions={})",
                sessionId, problem.getJobs().size(), problem.getResources().size(), solution != null, total);
    }

    @Override
    public Optional<SessionContext> get(String sessionId) {
        if (sessionId == null) return Optional.empty();

        SessionContext context = withLock(() -> contexts.get(sessionId));
        if (context == null) {
            logger.debug("No VRP context for session {}", sessionId);
        }
        return Optional.ofNullable(context);
    }

    @Override
    public boolean updateSolution(String sessionId, VrpSolution solution) {
        boolean updated = withLock(() -> {
            SessionContext existing = sessionId == null ? null : contexts.get(sessionId);
            if (existing == null) {
                return false;
            }
            contexts.put(sessionId, existing.toBuilder()
                    .solution(solution)
                    .updatedAt(clock.instant())
                    .build());
            return true;
        });

        if (updated) {
            logger.info("Updated solution for session {}", sessionId);
        } else {
            logger.warn("Ignored solution update for unknown session {}", sessionId);
        }
        return updated;
    }

    @Override
    public boolean delete(String sessionId) {
        boolean removed = withLock(() -> sessionId != null && contexts.remove(sessionId) != null);
        if (removed) {
            logger.info("Deleted VRP context for session {}", sessionId);
        }
        return removed;
    }

    @Override
    public List<String> listSessions() {
        return withLock(() -> List.copyOf(contexts.keySet()));
    }

    @Override
    public int evictOlderThan(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be a non-negative duration");
        }

        List<String> evicted = withLock(() -> {
            Instant now = clock.instant();
            List<String> removed = new ArrayList<>();
            Iterator<Map.Entry<String, SessionContext>> it = contexts.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, SessionContext> entry = it.next();
                Duration age = Duration.between(entry.getValue().getUpdatedAt(), now);
                if (age.compareTo(maxAge) > 0) {
                    removed.add(entry.getKey());
                    it.remove();
                }
            }
            return removed;
        });

        if (!evicted.isEmpty()) {
            logger.info("Evicted {} VRP contexts older than {}: {}", evicted.size(), maxAge, evicted);
        }
        return evicted.size();
    }

    @Override
    public int size() {
        return withLock(contexts::size);
    }

    private <T> T withLock(Supplier<T> action) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContextStoreException("Interrupted while waiting for context store lock", e);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
