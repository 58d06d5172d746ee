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
public class SubmitBallotHandler implements WebSocketCommandHandler {

    private final VoterService voterService;
    private final WebSocketPayloadReader payloadReader;
    private final CommandResponseSender responseSender;

    @Override
    public String getAction() {
        return "SUBMIT_BALLOT";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            VoterRequest dto = payloadReader.read(payload, VoterRequest.class);
            responseSender.sendSuccess(session.getId(), SocketEvent.BALLOT_ACCEPTED,
                    voterService.submitBallot(require(dto.getVoterId()), dto.getVoterSecret(), dto.getBallot()));
        } catch (Exception e) {
            responseSender.sendFailure(session.getId(), getAction(), e);
        }
    }
}
