package alerting.backend.domain;

public enum ReadStatus {
    UNREAD,
    READ
}
