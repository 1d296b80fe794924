package com.bko.delegation.orchestration.session;

import com.bko.delegation.orchestration.model.QualityTrend;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bookkeeping for one delegation chain. Mutated only by {@link SessionLedger} while holding the instance monitor.
 */
final class Session {

    private final String id;
    private final boolean subAgent;
    private final String parentId;
    private final int depth;
    private final Instant createdAt;
    private Instant lastActivity;
    private int callCount;
    private boolean loopDetected;
    private final Map<String, Integer> fingerprintCounts = new LinkedHashMap<>();
    private final Map<String, Integer> roleCalls = new LinkedHashMap<>();
    private final Map<String, RefinementTrack> refinements = new LinkedHashMap<>();

    Session(String id, boolean subAgent, @Nullable String parentId, int depth, Instant createdAt) {
        this.id = id;
        this.subAgent = subAgent;
        this.parentId = parentId;
        this.depth = depth;
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    String id() { return id; }
    boolean subAgent() { return subAgent; }
    @Nullable String parentId() { return parentId; }
    int depth() { return depth; }
    Instant createdAt() { return createdAt; }
    Instant lastActivity() { return lastActivity; }
    int callCount() { return callCount; }
    boolean loopDetected() { return loopDetected; }

    void touch(Instant now) {
        lastActivity = now;
    }

    void recordCall(String role) {
        callCount++;
        roleCalls.merge(role, 1, Integer::sum);
    }

    int recordFingerprint(String fingerprint) {
        return fingerprintCounts.merge(fingerprint, 1, Integer::sum);
    }

    void markLoop() {
        loopDetected = true;
    }

    Map<String, Integer> roleCalls() {
        return new LinkedHashMap<>(roleCalls);
    }

    RefinementTrack refinement(String role) {
        return refinements.computeIfAbsent(key(role), k -> new RefinementTrack(role));
    }

    @Nullable
    RefinementTrack existingRefinement(String role) {
        return refinements.get(key(role));
    }

    Map<String, Integer> refinementCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        refinements.values().forEach(track -> counts.put(track.role, track.attempts()));
        return counts;
    }

    List<RefinementTrack> refinementTracks() {
        return new ArrayList<>(refinements.values());
    }

    private static String key(String role) {
        return role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Score history of the refinement attempts made for one role.
     */
    static final class RefinementTrack {
        final String role;
        final List<Double> scores = new ArrayList<>();
        QualityTrend trend = QualityTrend.STABLE;
        String lastReason = "";
        Instant lastAttemptAt;

        RefinementTrack(String role) {
            this.role = role;
        }

        int attempts() {
            return scores.size();
        }
    }
}
