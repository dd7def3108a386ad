package io.lightclient.core.protocol;

/** What a commit slot attests to. Only {@link #COMMIT} carries voting power for the block. */
public enum BlockIdFlag {
    /** Validator did not vote; slot carries no address, timestamp or signature. */
    ABSENT,
    /** Validator precommitted the committed block. */
    COMMIT,
    /** Validator precommitted nil. */
    NIL
}
