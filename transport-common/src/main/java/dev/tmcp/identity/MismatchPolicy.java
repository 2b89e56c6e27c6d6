package dev.tmcp.identity;

/**
 * What to do when an opened envelope is not addressed from the expected peer to the local identity.
 */
public enum MismatchPolicy {

    /** Log a warning and hand the payload on. */
    WARN,

    /** Fail the open with an {@link dev.tmcp.channel.EnvelopeMismatchException}. */
    REJECT
}
