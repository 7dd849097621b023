package com.example.vrpassistant.context;

import com.example.vrpassistant.model.SessionContext;
import com.example.vrpassistant.model.VrpProblem;
import com.example.vrpassistant.model.VrpSolution;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Process-lifetime cache of the latest problem/solution pair per session.
 * <p>
 * All operations are atomic with respect to each other. Entries only ever disappear through
 * {@link #delete(String)} or {@link #evictOlderThan(Duration)}; there is no implicit TTL.
 * Session identifiers are supplied by the caller and trusted as-is.
 * </p>
 */
public interface ContextStore {

    /**
     * Inserts or fully replaces the context of {@code sessionId} and stamps it with the current time.
     */
    void save(String sessionId, VrpProblem problem, VrpSolution solution);

    /**
     * Returns an immutable snapshot, or empty when the session is unknown. Never throws for misses.
     */
    Optional<SessionContext> get(String sessionId);

    /**
     * Replaces only the solution of an existing session.
     *
     * @return {@code false} when the session does not exist; nothing is created in that case
     */
    boolean updateSolution(String sessionId, VrpSolution solution);

    boolean delete(String sessionId);

    /**
     * Snapshot of the session identifiers present at call time, in insertion order.
     */
    List<String> listSessions();

    /**
     * Removes every entry whose age, measured from its last write, exceeds {@code maxAge}.
     *
     * @return number of removed entries
     */
    int evictOlderThan(Duration maxAge);

    int size();
}
