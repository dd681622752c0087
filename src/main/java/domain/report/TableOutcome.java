package domain.report;

/**
 * Result of building one table for one state.
 */
public enum TableOutcome {

    /**
     * Table assembled and written.
     */
    BUILT,

    /**
     * Every non-GEOID cell was missing; nothing written.
     */
    EMPTY,

    /**
     * A sequence file was absent or malformed, or the template/appendix entry was missing.
     */
    SKIPPED
}
