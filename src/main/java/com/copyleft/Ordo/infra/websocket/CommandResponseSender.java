package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.constant.SocketEvent;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class CommandResponseSender {

    private final WebSocketSender webSocketSender;

    public <T> void sendSuccess(String sessionId, SocketEvent event, T data) {
        WebSocketResponse<T> response = WebSocketResponse.<T>builder()
                .event(event.name())
                .data(data)
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.ERROR_MESSAGE.name())
                .message(errorCode.getMessage())
                .code(errorCode.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }

    /**
     * 예상된 오류는 코드 그대로, 그 외(저장소 오류 등)는 로그에 남기고 UNKNOWN_ERROR로 보낸다.
     */
    public void sendFailure(String sessionId, String action, Exception e) {
        if (e instanceof OrdoException ordoException) {
            log.info("[{}] 요청 거절: session={}, code={}", action, sessionId, ordoException.getErrorCode());
            sendError(sessionId, ordoException.getErrorCode());
            return;
        }
        log.error("[{}] 처리 중 오류: session={}, msg={}", action, sessionId, e.getMessage(), e);
        sendError(sessionId, ErrorCode.UNKNOWN_ERROR);
    }
}
