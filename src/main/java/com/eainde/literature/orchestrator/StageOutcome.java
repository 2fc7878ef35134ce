package com.eainde.literature.orchestrator;

import com.eainde.literature.model.Stage;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * What has happened to one document so far in the current pass. Immutable; each
 * stage receives the previous outcome and returns a new one, so cascade and
 * blocking decisions depend only on this value.
 *
 * @param documentId  document being processed
 * @param results     per-stage result text: {@code completed}, {@code skipped}, or a failure
 * @param upstreamRan an earlier stage produced fresh output in this pass
 * @param unavailable stages that failed or were blocked in this pass
 */
public record StageOutcome(long documentId,
                           Map<Stage, String> results,
                           boolean upstreamRan,
                           Set<Stage> unavailable) {

    public static final String COMPLETED = "completed";
    public static final String SKIPPED = "skipped";

    public StageOutcome {
        results = Collections.unmodifiableMap(results.isEmpty() ? new EnumMap<>(Stage.class) : new EnumMap<>(results));
        unavailable = Collections.unmodifiableSet(unavailable.isEmpty() ? EnumSet.noneOf(Stage.class) : EnumSet.copyOf(unavailable));
    }

    public static StageOutcome start(long documentId) {
        return new StageOutcome(documentId, Map.of(), false, Set.of());
    }

    public StageOutcome ran(Stage stage) {
        return with(stage, COMPLETED, true, false);
    }

    public StageOutcome skipped(Stage stage) {
        return with(stage, SKIPPED, upstreamRan, false);
    }

    public StageOutcome failed(Stage stage, String message) {
        return with(stage, message, upstreamRan, true);
    }

    public StageOutcome blocked(Stage stage, Stage cause) {
        return with(stage, "blocked: " + cause.label() + " did not complete", upstreamRan, true);
    }

    public static final String CANCELLED = "cancelled";

    /**
     * Marks {@code from} and every later stage as cancelled.
     */
    public StageOutcome cancelled(Stage from) {
        StageOutcome next = this;
        for (Stage stage : Stage.values()) {
            if (stage.ordinal() >= from.ordinal()) {
                next = next.with(stage, CANCELLED, upstreamRan, true);
            }
        }
        return next;
    }

    /**
     * @return the prerequisite that failed or was blocked in this pass, or null
     */
    public Stage blockingPrerequisite(Stage stage) {
        Stage prerequisite = stage.prerequisite();
        return prerequisite != null && unavailable.contains(prerequisite) ? prerequisite : null;
    }

    public String result(Stage stage) {
        return results.get(stage);
    }

    private StageOutcome with(Stage stage, String result, boolean ran, boolean markUnavailable) {
        Map<Stage, String> nextResults = new EnumMap<>(Stage.class);
        nextResults.putAll(results);
        nextResults.put(stage, result);
        Set<Stage> nextUnavailable = EnumSet.noneOf(Stage.class);
        nextUnavailable.addAll(unavailable);
        if (markUnavailable) nextUnavailable.add(stage);
        return new StageOutcome(documentId, nextResults, ran, nextUnavailable);
    }
}
