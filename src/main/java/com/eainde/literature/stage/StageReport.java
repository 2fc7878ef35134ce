package com.eainde.literature.stage;

/**
 * @param modelUsed  model or provider that produced the payload, may be null
 * @param attemptLog failed fallback attempts, may be null
 * @param summary    one-line description for the log
 */
public record StageReport(String modelUsed, String attemptLog, String summary) {

    public static StageReport of(String summary) {
        return new StageReport(null, null, summary);
    }
}
