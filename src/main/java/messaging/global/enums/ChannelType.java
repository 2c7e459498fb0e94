package messaging.global.enums;

public enum ChannelType {
    PRODUCER_GROUP,
    ACCOUNT_GROUP,
    SHIPPING_GROUP,
    GENERAL
}
