package org.town.core.error;

public enum MapErrorCode {
    OUT_OF_BOUNDS,
    UNKNOWN_TILE,
    NO_MATCHING_CONNECTIVITY,
    DISCONNECTED_PLACEMENT,
    MISSING_ATLAS_REGION,
    BUDGET_EXCEEDED,
    INVALID_PLACEMENT
}
