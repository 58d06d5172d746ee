package com.copyleft.Ordo.infra.websocket.handler;

import com.copyleft.Ordo.feature.voter.VoterService;
import com.copyleft.Ordo.feature.voter.dto.VoterRequest;
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
public class GetVoterViewHandler implements WebSocketCommandHandler {

    private final VoterService voterService;
    private final WebSocketPayloadReader payloadReader;
    private final CommandResponseSender responseSender;

    @Override
    public String getAction() {
        return "GET_VOTER_VIEW";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            VoterRequest dto = payloadReader.read(payload, VoterRequest.class);
            responseSender.sendSuccess(session.getId(), SocketEvent.VOTER_VIEW,
                    voterService.getVoterView(require(dto.getVoterId()), dto.getVoterSecret()));
        } catch (Exception e) {
            responseSender.sendFailure(session.getId(), getAction(), e);
        }
    }
}
