package com.eainde.literature.orchestrator;

/**
 * Result of a stage's data-existence predicate.
 */
public enum DataCheck {
    PRESENT,
    ABSENT,
    /** the stage declares no predicate (Extraction: zero records is a valid result) */
    NOT_CHECKED
}
