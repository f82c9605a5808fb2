package com.chambua.standings.exception;

/**
 * What the caller of a failed operation should do next.
 */
public enum ErrorCategory {
    /** Overload or a transient store problem; the same request may succeed later. */
    RETRY_LATER,
    /** The request or the match data is wrong and has to be corrected first. */
    FIX_INPUT,
    /** Internal inconsistency; needs an operator. */
    CONTACT_OPERATOR
}
