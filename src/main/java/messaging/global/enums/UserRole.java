package messaging.global.enums;

public enum UserRole {
    REP,
    MANAGER,
    ADMIN
}
