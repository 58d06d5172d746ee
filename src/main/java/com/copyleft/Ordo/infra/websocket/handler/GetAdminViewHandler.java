package com.copyleft.Ordo.infra.websocket.handler;

import com.copyleft.Ordo.feature.room.RoomService;
import com.copyleft.Ordo.feature.room.dto.RoomRequest;
import com.copyleft.Ordo.global.constant.SocketEvent;
import com.copyleft.Ordo.infra.websocket.CommandResponseSender;
import com.copyleft.Ordo.infra.websocket.WebSocketPayloadReader;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import static com.copyleft.Ordo.infra.websocket.WebSocketPayloadReader.require;

@Component
@RequiredArgsConstructor
public class GetAdminViewHandler implements WebSocketCommandHandler {

    private final RoomService roomService;
    private final WebSocketPayloadReader payloadReader;
    private final CommandResponseSender responseSender;

    @Override
    public String getAction() {
        return "GET_ADMIN_VIEW";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            RoomRequest dto = payloadReader.read(payload, RoomRequest.class);
            responseSender.sendSuccess(session.getId(), SocketEvent.ADMIN_VIEW,
                    roomService.getAdminView(require(dto.getRoomId()), dto.getAdminSecret()));
        } catch (Exception e) {
            responseSender.sendFailure(session.getId(), getAction(), e);
        }
    }
}
