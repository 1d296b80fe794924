package com.bko.delegation.orchestration.session;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.DepthExceededException;
import com.bko.delegation.error.RefinementCapExceededException;
import com.bko.delegation.error.SessionLimitExceededException;
import com.bko.delegation.error.SessionNotFoundException;
import com.bko.delegation.orchestration.model.GlobalStats;
import com.bko.delegation.orchestration.model.QualityTrend;
import com.bko.delegation.orchestration.model.RefinementState;
import com.bko.delegation.orchestration.model.SessionStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory store of delegation sessions: spawn depth, call quotas, loop detection,
 * refinement attempts and the global in-flight worker capacity.
 * <p>
 * Sessions are independent of each other; each one is guarded by its own monitor so parallel
 * batch members can record calls against a shared coordinator without lost updates.
 */
@Service
@Slf4j
public class SessionLedger {

    private final DelegationProperties properties;
    private final Clock clock;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger agentsInFlight = new AtomicInteger();

    @Autowired
    public SessionLedger(DelegationProperties properties) {
        this(properties, Clock.systemUTC());
    }

    SessionLedger(DelegationProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public String createSession(boolean subAgent, @Nullable String parentId) {
        evictExpired();
        int depth = 0;
        if (parentId != null) {
            Session parent = require(parentId);
            synchronized (parent) {
                depth = parent.depth() + 1;
                parent.touch(clock.instant());
            }
            int maxDepth = properties.getSession().getMaxDepth();
            if (depth > maxDepth) {
                throw new DepthExceededException(
                        "Cannot create session: maximum depth exceeded (" + depth + "/" + maxDepth + ")",
                        parentId,
                        counters("currentDepth", depth, "maxDepth", maxDepth),
                        "Increase delegation.session.max-depth or let the parent agent handle the task directly.");
            }
        }
        String id = UUID.randomUUID().toString();
        sessions.put(id, new Session(id, subAgent, parentId, depth, clock.instant()));
        log.info("Created session. sessionId={}, subAgent={}, parentId={}, depth={}, activeSessions={}",
                id, subAgent, parentId, depth, sessions.size());
        return id;
    }

    public boolean canSpawnAgent(String sessionId) {
        return spawnBlockReason(sessionId).isEmpty();
    }

    /**
     * Throws the taxonomy error matching the first exhausted limit of the session.
     */
    public void checkCanSpawn(String sessionId) {
        Session session = require(sessionId);
        Optional<String> reason = spawnBlockReason(sessionId);
        if (reason.isEmpty()) {
            return;
        }
        Map<String, Object> counters = counterSnapshot(session);
        if (session.depth() >= properties.getSession().getMaxDepth() && !session.loopDetected()
                && session.callCount() < properties.getSession().getMaxTotalCalls()) {
            throw new DepthExceededException("Cannot spawn agent: " + reason.get(), sessionId, counters,
                    "Increase delegation.session.max-depth or complete the task in the current agent.");
        }
        throw new SessionLimitExceededException("Cannot spawn agent: " + reason.get(), sessionId, counters,
                session.loopDetected()
                        ? "Stop re-delegating the same task; rephrase it or handle it directly."
                        : "Start a new session or increase delegation.session.max-total-calls.");
    }

    public boolean canSpawnParallelAgents(int count) {
        int maxParallel = properties.getSession().getMaxParallelAgents();
        if (count < 1 || count > maxParallel) {
            return false;
        }
        return agentsInFlight.get() + count <= properties.getSession().getMaxConcurrentAgents();
    }

    /**
     * Atomically reserves global worker capacity. Returns false when the reservation would exceed it.
     */
    public boolean reserveCapacity(int count) {
        int max = properties.getSession().getMaxConcurrentAgents();
        while (true) {
            int current = agentsInFlight.get();
            if (current + count > max) {
                return false;
            }
            if (agentsInFlight.compareAndSet(current, current + count)) {
                return true;
            }
        }
    }

    public void releaseCapacity(int count) {
        agentsInFlight.updateAndGet(current -> Math.max(0, current - count));
    }

    public void trackAgentCall(String sessionId, String role, String fingerprint, boolean refinement) {
        Session session = require(sessionId);
        int maxCalls = properties.getSession().getMaxTotalCalls();
        synchronized (session) {
            if (session.callCount() >= maxCalls) {
                throw new SessionLimitExceededException(
                        "Maximum total calls exceeded (" + maxCalls + ")",
                        sessionId,
                        counterSnapshot(session),
                        "Start a new session or increase delegation.session.max-total-calls.");
            }
            session.recordCall(role);
            if (!refinement) {
                int seen = session.recordFingerprint(fingerprint);
                if (seen > properties.getSession().getLoopRepeatThreshold() && !session.loopDetected()) {
                    session.markLoop();
                    log.warn("Delegation loop detected. sessionId={}, role={}, repeats={}", sessionId, role, seen);
                }
            }
            session.touch(clock.instant());
            log.debug("Tracked agent call. sessionId={}, role={}, totalCalls={}, refinement={}",
                    sessionId, role, session.callCount(), refinement);
        }
    }

    public String generateTaskHash(String task, String context, String role) {
        String combined = nullToEmpty(task) + "|" + nullToEmpty(context) + "|" + nullToEmpty(role);
        return DigestUtils.md5DigestAsHex(combined.getBytes(StandardCharsets.UTF_8));
    }

    public RefinementState trackRefinementAttempt(String sessionId, String role, double score, String reason) {
        Session session = require(sessionId);
        int cap = properties.getQuality().getMaxRefinementAttempts();
        synchronized (session) {
            Session.RefinementTrack track = session.refinement(role);
            if (track.attempts() >= cap) {
                throw new RefinementCapExceededException(
                        "Maximum refinement attempts reached for role " + role + " (" + cap + ")",
                        sessionId,
                        counters("attempts", track.attempts(), "maxAttempts", cap),
                        "Accept the current output or spawn a fresh session with a clarified task.");
            }
            track.scores.add(score);
            track.trend = computeTrend(track.scores);
            track.lastReason = reason;
            track.lastAttemptAt = clock.instant();
            session.touch(track.lastAttemptAt);
            log.info("Refinement attempt recorded. sessionId={}, role={}, attempt={}, score={}, trend={}",
                    sessionId, role, track.attempts(), score, track.trend);
            return toState(sessionId, track);
        }
    }

    public Optional<RefinementState> getRefinementState(String sessionId, String role) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            Session.RefinementTrack track = session.existingRefinement(role);
            return track == null ? Optional.empty() : Optional.of(toState(sessionId, track));
        }
    }

    public int getRefinementCount(String sessionId, String role) {
        return getRefinementState(sessionId, role).map(RefinementState::attemptNumber).orElse(0);
    }

    public List<RefinementState> getRefinementStates(String sessionId) {
        Session session = require(sessionId);
        synchronized (session) {
            return session.refinementTracks().stream().map(track -> toState(sessionId, track)).toList();
        }
    }

    public boolean hasSession(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public SessionStats getSessionStats(String sessionId) {
        Session session = require(sessionId);
        Instant now = clock.instant();
        synchronized (session) {
            return new SessionStats(
                    session.id(),
                    session.subAgent(),
                    session.parentId(),
                    session.depth(),
                    session.callCount(),
                    properties.getSession().getMaxTotalCalls(),
                    session.roleCalls(),
                    session.refinementCounts(),
                    session.loopDetected(),
                    Duration.between(session.createdAt(), now).toMinutes(),
                    Duration.between(session.lastActivity(), now).toMinutes(),
                    session.createdAt(),
                    session.lastActivity());
        }
    }

    public GlobalStats getGlobalStats() {
        int subAgents = 0;
        long totalCalls = 0;
        for (Session session : sessions.values()) {
            synchronized (session) {
                if (session.subAgent()) {
                    subAgents++;
                }
                totalCalls += session.callCount();
            }
        }
        int total = sessions.size();
        return new GlobalStats(total, subAgents, total - subAgents, totalCalls, agentsInFlight.get());
    }

    void evictExpired() {
        Instant cutoff = clock.instant().minus(properties.getSession().getTimeout());
        int before = sessions.size();
        sessions.values().removeIf(session -> session.lastActivity().isBefore(cutoff));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("Evicted expired sessions. count={}, remaining={}", evicted, sessions.size());
        }
    }

    private Optional<String> spawnBlockReason(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.of("unknown session");
        }
        synchronized (session) {
            if (session.loopDetected()) {
                return Optional.of("delegation loop detected (same task repeated more than "
                        + properties.getSession().getLoopRepeatThreshold() + " times)");
            }
            int maxCalls = properties.getSession().getMaxTotalCalls();
            if (session.callCount() >= maxCalls) {
                return Optional.of("maximum total calls exceeded (" + session.callCount() + "/" + maxCalls + ")");
            }
            int maxDepth = properties.getSession().getMaxDepth();
            if (session.depth() >= maxDepth) {
                return Optional.of("maximum depth exceeded (" + session.depth() + "/" + maxDepth + ")");
            }
            return Optional.empty();
        }
    }

    private QualityTrend computeTrend(List<Double> scores) {
        if (scores.size() < 2) {
            return QualityTrend.STABLE;
        }
        double delta = scores.get(scores.size() - 1) - scores.get(scores.size() - 2);
        double minDelta = properties.getQuality().getTrendMinDelta();
        if (delta > minDelta) {
            return QualityTrend.IMPROVING;
        }
        if (delta < -minDelta) {
            return QualityTrend.DEGRADING;
        }
        return QualityTrend.STABLE;
    }

    private RefinementState toState(String sessionId, Session.RefinementTrack track) {
        return new RefinementState(sessionId, track.role, track.attempts(), List.copyOf(track.scores),
                track.trend, track.lastReason, track.lastAttemptAt);
    }

    private Session require(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private Map<String, Object> counterSnapshot(Session session) {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("currentDepth", session.depth());
        counters.put("maxDepth", properties.getSession().getMaxDepth());
        counters.put("totalCalls", session.callCount());
        counters.put("maxTotalCalls", properties.getSession().getMaxTotalCalls());
        counters.put("loopDetected", session.loopDetected());
        return counters;
    }

    private static Map<String, Object> counters(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put(k1, v1);
        counters.put(k2, v2);
        return counters;
    }

    private static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
