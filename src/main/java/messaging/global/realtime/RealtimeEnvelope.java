package messaging.global.realtime;

/**
 * STOMP MESSAGE 본문: {"event": "...", "data": {...}}
 */
public record RealtimeEnvelope(String event, Object data) {
}
