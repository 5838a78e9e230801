package com.streamfirst.shush.domain;

/**
 * Why a single registry operation did not take effect.
 */
public enum FailureKind {
    /** Transport failure, timeout or 5xx after retries were exhausted */
    UNAVAILABLE,
    /** An unexpired silence with different settings already exists */
    CONFLICT,
    /** Credentials rejected */
    UNAUTHORIZED,
    /** The addressed resource no longer exists */
    NOT_FOUND,
    /** Not attempted because the invocation was cancelled or ran out of time */
    CANCELLED,
    /** Anything the registry client could not classify */
    UNEXPECTED
}
