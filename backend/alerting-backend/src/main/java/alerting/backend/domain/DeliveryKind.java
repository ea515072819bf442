package alerting.backend.domain;

public enum DeliveryKind {
    INITIAL,
    REMINDER
}
