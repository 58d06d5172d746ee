package com.copyleft.Ordo.infra.websocket.handler;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.feature.broadcast.RoomEventBus;
import com.copyleft.Ordo.feature.broadcast.RoomSubscription;
import com.copyleft.Ordo.feature.broadcast.SubscriberRole;
import com.copyleft.Ordo.feature.broadcast.SubscriberRoleResolver;
import com.copyleft.Ordo.feature.room.RoomService;
import com.copyleft.Ordo.global.constant.ErrorCode;
import com.copyleft.Ordo.global.constant.SocketEvent;
import com.copyleft.Ordo.global.exception.OrdoException;
import com.copyleft.Ordo.infra.websocket.CommandResponseSender;
import com.copyleft.Ordo.infra.websocket.RoomStreamRelay;
import com.copyleft.Ordo.infra.websocket.WebSocketPayloadReader;
import com.copyleft.Ordo.infra.websocket.WebSocketSessionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscribeHandlerTest {

    private static final String ROOM_ID = "r1";
    private static final String PAYLOAD = "{\"roomId\":\"r1\"}";

    @Mock private RoomService roomService;
    @Mock private SubscriberRoleResolver roleResolver;
    @Mock private RoomStreamRelay streamRelay;
    @Mock private WebSocketSessionManager sessionManager;
    @Mock private CommandResponseSender responseSender;
    @Mock private WebSocketSession session;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RoomEventBus eventBus;
    private SubscribeHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(session.getId()).thenReturn("s1");
        lenient().when(roleResolver.resolve(eq(ROOM_ID), any(), any(), any())).thenReturn(SubscriberRole.anonymous());
        eventBus = new RoomEventBus(new OrdoProperties(3600, 1, 8, 32));
        handler = new SubscribeHandler(roomService, eventBus, roleResolver, streamRelay,
                sessionManager, new WebSocketPayloadReader(objectMapper), responseSender);
    }

    @Test
    @DisplayName("구독 성공 시 SUBSCRIBED를 보내고 릴레이를 시작한다")
    void handle_Success() throws Exception {
        // when
        handler.handle(session, objectMapper.readTree(PAYLOAD));

        // then
        assertTrue(eventBus.hasChannel(ROOM_ID));
        verify(sessionManager).attachSubscription(eq("s1"), any(RoomSubscription.class));
        verify(responseSender).sendSuccess("s1", SocketEvent.SUBSCRIBED,
                Map.of("roomId", ROOM_ID, "role", "ANONYMOUS"));
        verify(streamRelay).relay(eq("s1"), eq(SubscriberRole.anonymous()), any(RoomSubscription.class));
    }

    @Test
    @DisplayName("구독 직전에 방이 만료됐다면 채널을 남기지 않고 ROOM_NOT_FOUND로 실패한다")
    void handle_RoomExpiredWhileSubscribing() throws Exception {
        // given
        OrdoException error = new OrdoException(ErrorCode.ROOM_NOT_FOUND);
        when(roomService.getRoom(ROOM_ID)).thenThrow(error);

        // when
        handler.handle(session, objectMapper.readTree(PAYLOAD));

        // then
        assertFalse(eventBus.hasChannel(ROOM_ID));
        verify(responseSender).sendFailure("s1", "SUBSCRIBE", error);
        verify(sessionManager, never()).attachSubscription(any(), any());
        verifyNoInteractions(streamRelay);
    }

    @Test
    @DisplayName("만료된 방 채널에 먼저 붙어 있던 구독도 함께 닫힌다")
    void handle_RoomExpiredClosesEarlierSubscribers() throws Exception {
        // given
        RoomSubscription earlier = eventBus.subscribe(ROOM_ID);
        when(roomService.getRoom(ROOM_ID)).thenThrow(new OrdoException(ErrorCode.ROOM_NOT_FOUND));

        // when
        handler.handle(session, objectMapper.readTree(PAYLOAD));

        // then
        assertTrue(earlier.isClosed());
        assertFalse(eventBus.hasChannel(ROOM_ID));
    }

    @Test
    @DisplayName("예상하지 못한 오류면 자기 구독만 닫고 다른 구독자는 그대로 둔다")
    void handle_UnexpectedErrorClosesOwnSubscription() throws Exception {
        // given
        RoomSubscription other = eventBus.subscribe(ROOM_ID);
        IllegalStateException error = new IllegalStateException("db down");
        when(roomService.getRoom(ROOM_ID)).thenThrow(error);

        // when
        handler.handle(session, objectMapper.readTree(PAYLOAD));

        // then
        assertFalse(other.isClosed());
        assertEquals(1, eventBus.subscriberCount(ROOM_ID));
        verify(responseSender).sendFailure("s1", "SUBSCRIBE", error);
        verifyNoInteractions(streamRelay);
    }
}
