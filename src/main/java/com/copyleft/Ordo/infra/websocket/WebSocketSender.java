package com.copyleft.Ordo.infra.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;

    /**
     * @return 전송 성공 여부. 세션이 없거나 닫혀 있으면 false.
     */
    public boolean sendEventToSession(String sessionId, Object event) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) {
            log.debug("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
            return false;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            session.sendMessage(new TextMessage(payload));
            log.debug("이벤트 전송 (1:1): [세션 ID: {}], [페이로드: {}]", sessionId, payload);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("1:1 이벤트 전송 실패: [세션 ID: {}], [오류: {}]", sessionId, e.getMessage());
            return false;
        }
    }
}
