package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.constant.SocketEvent;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.infra.websocket.dto.WebSocketResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CommandResponseSenderTest {

    @InjectMocks
    private CommandResponseSender responseSender;

    @Mock
    private WebSocketSender webSocketSender;

    private WebSocketResponse<?> sentResponse() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(webSocketSender).sendEventToSession(eq("s1"), captor.capture());
        return (WebSocketResponse<?>) captor.getValue();
    }

    @Test
    @DisplayName("성공 응답은 이벤트 이름과 데이터를 담는다")
    void sendSuccess() {
        responseSender.sendSuccess("s1", SocketEvent.ROOM_INFO, "payload");

        WebSocketResponse<?> response = sentResponse();
        assertEquals("ROOM_INFO", response.getEvent());
        assertEquals("payload", response.getData());
        assertNull(response.getCode());
    }

    @Test
    @DisplayName("예상된 오류는 해당 오류 코드로 응답한다")
    void sendFailure_OrdoException() {
        responseSender.sendFailure("s1", "JOIN_ROOM", new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        WebSocketResponse<?> response = sentResponse();
        assertEquals("ERROR_MESSAGE", response.getEvent());
        assertEquals("ROOM_NOT_FOUND", response.getCode());
        assertEquals(ErrorCode.ROOM_NOT_FOUND.getMessage(), response.getMessage());
    }

    @Test
    @DisplayName("예상하지 못한 오류는 UNKNOWN_ERROR로 감싼다")
    void sendFailure_UnexpectedException() {
        responseSender.sendFailure("s1", "END_VOTE", new IllegalStateException("db down"));

        WebSocketResponse<?> response = sentResponse();
        assertEquals("UNKNOWN_ERROR", response.getCode());
    }
}
