package com.eainde.literature.orchestrator;

import com.eainde.literature.model.StageStatus;

/**
 * @param action         run or skip
 * @param reason         why
 * @param statusToRecord status to persist before running, set only for a desync
 */
public record StageDecision(Action action, Reason reason, StageStatus statusToRecord) {

    public enum Action { RUN, SKIP }

    public enum Reason {
        FORCED,
        UPSTREAM_RAN,
        NOT_COMPLETED,
        DESYNC,
        UP_TO_DATE
    }

    static StageDecision run(Reason reason) {
        return new StageDecision(Action.RUN, reason, null);
    }

    static StageDecision skip() {
        return new StageDecision(Action.SKIP, Reason.UP_TO_DATE, null);
    }

    public boolean shouldRun() {
        return action == Action.RUN;
    }
}
