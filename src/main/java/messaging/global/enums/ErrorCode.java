package messaging.global.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "invalid request"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "authentication required"),
    DATA_CONFLICT(HttpStatus.CONFLICT, "the request conflicts with existing data, please retry"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "internal error"),

    // 사용자
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "user not found"),

    // 채널
    CHANNEL_NOT_FOUND(HttpStatus.NOT_FOUND, "channel not found"),
    INVALID_CHANNEL_NAME(HttpStatus.BAD_REQUEST, "channel name required"),
    NOT_CHANNEL_MEMBER(HttpStatus.FORBIDDEN, "you can't do that here"),
    NOT_CHANNEL_ADMIN(HttpStatus.FORBIDDEN, "only a channel admin can do that"),
    ALREADY_CHANNEL_MEMBER(HttpStatus.CONFLICT, "user is already a member of this channel"),
    CHANNEL_MEMBER_NOT_FOUND(HttpStatus.NOT_FOUND, "user is not a member of this channel"),
    CANNOT_REMOVE_SELF(HttpStatus.BAD_REQUEST, "you can't remove yourself from a channel"),

    // DM
    DM_THREAD_NOT_FOUND(HttpStatus.NOT_FOUND, "conversation not found"),
    NOT_THREAD_PARTICIPANT(HttpStatus.FORBIDDEN, "you can't do that here"),
    SELF_DM(HttpStatus.BAD_REQUEST, "cannot start a direct message with yourself"),

    // 메시지
    EMPTY_MESSAGE_BODY(HttpStatus.BAD_REQUEST, "message body required"),
    INVALID_MESSAGE_CURSOR(HttpStatus.BAD_REQUEST, "before must reference a message in this conversation");

    private final HttpStatus status;
    private final String message;
}
