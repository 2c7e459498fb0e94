package messaging.global.realtime;

import java.util.regex.Pattern;

/**
 * STOMP 목적지 규칙. 채널/DM 룸은 브로커 토픽이고, 개인 룸은 사용자 목적지(/user/queue/events)다.
 */
public final class RoomKeys {

    public static final String TOPIC_PREFIX = "/topic";
    public static final String USER_PREFIX = "/user";
    public static final String QUEUE_PREFIX = "/queue";
    public static final String USER_EVENTS = QUEUE_PREFIX + "/events";
    public static final String USER_EVENTS_SUBSCRIPTION = USER_PREFIX + USER_EVENTS;

    private static final String CHANNEL_PREFIX = TOPIC_PREFIX + "/channels/";
    private static final String DM_PREFIX = TOPIC_PREFIX + "/dm/";
    private static final Pattern ROOM_TOPIC = Pattern.compile("^/topic/(channels|dm)/\\d+$");

    private RoomKeys() {
    }

    public static String channel(Long channelId) {
        return CHANNEL_PREFIX + channelId;
    }

    public static String dmThread(Long threadId) {
        return DM_PREFIX + threadId;
    }

    /**
     * 클라이언트가 구독할 수 있는 목적지인지. 멤버십은 여기서 다시 확인하지 않는다.
     */
    public static boolean isSubscribable(String destination) {
        if (destination == null) {
            return false;
        }
        return USER_EVENTS_SUBSCRIPTION.equals(destination) || ROOM_TOPIC.matcher(destination).matches();
    }
}
