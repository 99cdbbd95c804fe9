/* (C)2026 */
package com.ammann.abstats.enumeration;

/**
 * Source of the control-to-treatment allocation ratio used by the post-hoc sample size solver
 * when a request does not supply one explicitly.
 */
public enum AllocationMode {
    /** Use the as-run ratio of control to treatment counts. */
    OBSERVED,

    /** Assume a 1:1 split. */
    EQUAL
}
