package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.feature.broadcast.ProjectedEvent;
import com.copyleft.Ordo.feature.broadcast.RoomEventProjector;
import com.copyleft.Ordo.feature.broadcast.RoomSubscription;
import com.copyleft.Ordo.feature.broadcast.SubscriberRole;
import com.copyleft.Ordo.feature.broadcast.SubscriptionSignal;
import com.copyleft.Ordo.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.time.Duration;

/**
 * 구독 하나를 비우면서 역할별로 투영한 이벤트를 세션에 보낸다.
 * 투영 결과가 없거나, 대기 시간이 지나거나, 버퍼 유실이 생기면 하트비트를 보낸다.
 * 채널이 해제되면 세션을 닫아 클라이언트에 종료를 알린다. 교체된 구독은 조용히 끝난다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomStreamRelay {

    private final RoomEventProjector projector;
    private final WebSocketSender webSocketSender;
    private final WebSocketSessionManager sessionManager;
    private final OrdoProperties ordoProperties;

    @Async("relayExecutor")
    public void relay(String sessionId, SubscriberRole role, RoomSubscription subscription) {
        Duration heartbeat = Duration.ofSeconds(ordoProperties.heartbeatSeconds());
        log.info("구독 릴레이 시작: session={}, room={}, role={}", sessionId, subscription.getRoomId(), role.kind());

        try {
            while (true) {
                SubscriptionSignal signal = subscription.next(heartbeat);

                if (signal.kind() == SubscriptionSignal.Kind.CLOSED) {
                    // 같은 세션의 새 구독으로 교체된 경우에는 세션을 닫지 않는다
                    if (sessionManager.detachSubscription(sessionId, subscription)) {
                        sessionManager.closeSession(sessionId, CloseStatus.NORMAL);
                        log.info("구독 스트림 종료: session={}, room={}", sessionId, subscription.getRoomId());
                    } else {
                        log.info("교체되었거나 연결이 끊긴 구독 종료: session={}, room={}", sessionId, subscription.getRoomId());
                    }
                    return;
                }
                if (signal.kind() == SubscriptionSignal.Kind.LAGGED) {
                    log.debug("구독자 지연, 이벤트 {}건 유실: session={}", signal.missed(), sessionId);
                }

                ProjectedEvent projected = signal.kind() == SubscriptionSignal.Kind.EVENT
                        ? projector.project(signal.event(), role).orElseGet(ProjectedEvent::heartbeat)
                        : ProjectedEvent.heartbeat();

                if (!send(sessionId, projected)) {
                    // 연결이 끊긴 구독자: 방 상태와 무관하게 구독만 버린다
                    subscription.close();
                    sessionManager.detachSubscription(sessionId, subscription);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            log.info("구독 릴레이 중단: session={}", sessionId);
        }
    }

    private boolean send(String sessionId, ProjectedEvent projected) {
        WebSocketResponse<Object> response = WebSocketResponse.builder()
                .event(projected.event().name())
                .data(projected.data())
                .build();
        return webSocketSender.sendEventToSession(sessionId, response);
    }
}
