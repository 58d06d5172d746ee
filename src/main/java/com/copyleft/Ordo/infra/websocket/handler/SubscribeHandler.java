package com.copyleft.Ordo.infra.websocket.handler;

import com.copyleft.Ordo.feature.broadcast.RoomEventBus;
import com.copyleft.Ordo.feature.broadcast.RoomSubscription;
import com.copyleft.Ordo.feature.broadcast.SubscriberRole;
import com.copyleft.Ordo.feature.broadcast.SubscriberRoleResolver;
import com.copyleft.Ordo.feature.broadcast.dto.SubscribeRequest;
import com.copyleft.Ordo.feature.room.RoomService;
import com.copyleft.Ordo.global.constant.SocketEvent;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.infra.websocket.CommandResponseSender;
import com.copyleft.Ordo.infra.websocket.RoomStreamRelay;
import com.copyleft.Ordo.infra.websocket.WebSocketPayloadReader;
import com.copyleft.Ordo.infra.websocket.WebSocketSessionManager;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;

import static com.copyleft.Ordo.infra.websocket.WebSocketPayloadReader.require;

@Slf4j
@Component
@RequiredArgsConstructor
public class SubscribeHandler implements WebSocketCommandHandler {

    private final RoomService roomService;
    private final RoomEventBus eventBus;
    private final SubscriberRoleResolver roleResolver;
    private final RoomStreamRelay streamRelay;
    private final WebSocketSessionManager sessionManager;
    private final WebSocketPayloadReader payloadReader;
    private final CommandResponseSender responseSender;

    @Override
    public String getAction() {
        return "SUBSCRIBE";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            SubscribeRequest dto = payloadReader.read(payload, SubscribeRequest.class);
            String roomId = require(dto.getRoomId());

            SubscriberRole role = roleResolver.resolve(roomId, dto.getAdminSecret(), dto.getVoterId(), dto.getVoterSecret());
            RoomSubscription subscription = eventBus.subscribe(roomId);

            // 방 확인은 구독 등록 뒤에 한다. 그 사이 만료됐다면 여기서 채널을 걷어낸다
            try {
                roomService.getRoom(roomId);
            } catch (OrdoException e) {
                eventBus.teardown(roomId);
                throw e;
            } catch (RuntimeException e) {
                subscription.close();
                throw e;
            }

            sessionManager.attachSubscription(session.getId(), subscription);

            responseSender.sendSuccess(session.getId(), SocketEvent.SUBSCRIBED,
                    Map.of("roomId", roomId, "role", role.kind().name()));

            streamRelay.relay(session.getId(), role, subscription);
        } catch (Exception e) {
            responseSender.sendFailure(session.getId(), getAction(), e);
        }
    }
}
