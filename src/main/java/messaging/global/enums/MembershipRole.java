package messaging.global.enums;

public enum MembershipRole {
    MEMBER,
    ADMIN
}
