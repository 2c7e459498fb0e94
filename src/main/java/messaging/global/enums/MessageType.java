package messaging.global.enums;

public enum MessageType {
    MESSAGE,
    SYSTEM
}
