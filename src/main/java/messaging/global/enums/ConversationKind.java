package messaging.global.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum ConversationKind {
    CHANNEL("channel"),
    DM("dm");

    private final String value;

    @JsonValue
    public String getValue() {
        return value;
    }
}
