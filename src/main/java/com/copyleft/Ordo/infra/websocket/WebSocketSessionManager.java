package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.feature.broadcast.RoomSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class WebSocketSessionManager {

    private final ConcurrentHashMap<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    // 세션당 구독은 하나
    private final ConcurrentHashMap<String, RoomSubscription> subscriptions = new ConcurrentHashMap<>();

    private static final int SEND_TIME_LIMIT = 5000;
    private static final int BUFFER_SIZE_LIMIT = 1024 * 64;

    public void registerSession(WebSocketSession session) {
        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                session, SEND_TIME_LIMIT, BUFFER_SIZE_LIMIT);
        sessions.put(session.getId(), concurrentSession);
    }

    /**
     * 연결 종료 시 호출. 걸려 있던 구독도 조용히 해제한다 (방 상태에는 영향 없음).
     */
    public void removeSession(WebSocketSession session) {
        sessions.remove(session.getId());
        RoomSubscription subscription = subscriptions.remove(session.getId());
        if (subscription != null) {
            subscription.close();
        }
    }

    public WebSocketSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public void attachSubscription(String sessionId, RoomSubscription subscription) {
        RoomSubscription previous = subscriptions.put(sessionId, subscription);
        if (previous != null) {
            previous.close();
        }
    }

    /**
     * @return 이 구독이 아직 세션에 걸려 있어서 떼어냈으면 true.
     *         새 구독으로 교체됐거나 세션이 이미 정리됐으면 false.
     */
    public boolean detachSubscription(String sessionId, RoomSubscription subscription) {
        return subscriptions.remove(sessionId, subscription);
    }

    public void closeSession(String sessionId, CloseStatus status) {
        WebSocketSession session = sessions.get(sessionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("세션 종료 실패: {}", sessionId, e);
        }
    }
}
