package messaging.global.enums;

/**
 * 실시간 소켓으로 내려가는 이벤트 이름. 상수 이름이 그대로 프레임의 event 값이 된다.
 */
public enum RealtimeEventType {
    new_message,
    conversation_update,
    channel_renamed
}
