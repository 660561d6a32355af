package app.semble.core.firehose.domain;

/**
 * Outcome of handling one firehose event. None of these is an error.
 */
public enum FirehoseProcessingResult {
    // local state was brought in line with the event
    APPLIED,
    // the event had already been applied
    SKIPPED,
    // unknown, unresolvable or malformed; nothing changed
    IGNORED
}
