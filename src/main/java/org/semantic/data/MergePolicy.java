package org.semantic.data;

/**
 * Decides which binding wins when the filtered environments of several same-named module
 * candidates are combined.
 */
public enum MergePolicy {
    /** The candidate processed first keeps its binding on a name collision. */
    FIRST_WINS,
    /** The candidate processed last replaces earlier bindings on a name collision. */
    LAST_WINS
}
