package app.semble.core.firehose.domain;

public enum FirehoseEventType {
    CREATE,
    UPDATE,
    DELETE
}
