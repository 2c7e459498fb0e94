package messaging.domain.message.entity;

import messaging.global.enums.ConversationKind;
import messaging.global.realtime.RoomKeys;

/**
 * 메시지가 속한 대화. 채널 또는 DM 스레드 중 정확히 하나다.
 */
public interface ConversationRef {

    Long id();

    ConversationKind kind();

    /** 이 대화의 STOMP 토픽 */
    String roomId();

    record ChannelRef(Long id) implements ConversationRef {
        @Override
        public ConversationKind kind() {
            return ConversationKind.CHANNEL;
        }

        @Override
        public String roomId() {
            return RoomKeys.channel(id);
        }
    }

    record DmThreadRef(Long id) implements ConversationRef {
        @Override
        public ConversationKind kind() {
            return ConversationKind.DM;
        }

        @Override
        public String roomId() {
            return RoomKeys.dmThread(id);
        }
    }
}
