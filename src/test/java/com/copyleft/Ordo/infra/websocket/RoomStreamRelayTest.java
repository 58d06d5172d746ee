package com.copyleft.Ordo.infra.websocket;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.domain.vo.TallyEntry;
import com.copyleft.Ordo.feature.broadcast.RoomEvent;
import com.copyleft.Ordo.feature.broadcast.RoomEventBus;
import com.copyleft.Ordo.feature.broadcast.RoomEventProjector;
import com.copyleft.Ordo.feature.broadcast.RoomSubscription;
import com.copyleft.Ordo.feature.broadcast.SubscriberRole;
import com.copyleft.Ordo.infra.websocket.dto.WebSocketResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomStreamRelayTest {

    private static final String SESSION_ID = "session-1";
    private static final String ROOM_ID = "room-1";

    @Mock private WebSocketSender webSocketSender;
    @Mock private WebSocketSessionManager sessionManager;

    private RoomEventBus eventBus;
    private RoomStreamRelay relay;

    @BeforeEach
    void setUp() {
        OrdoProperties properties = new OrdoProperties(3600, 1, 8, 32);
        eventBus = new RoomEventBus(properties);
        relay = new RoomStreamRelay(new RoomEventProjector(), webSocketSender, sessionManager, properties);
    }

    private List<String> sentEvents(int times) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(webSocketSender, times(times)).sendEventToSession(eq(SESSION_ID), captor.capture());
        return captor.getAllValues().stream()
                .map(response -> ((WebSocketResponse<?>) response).getEvent())
                .toList();
    }

    @Test
    @DisplayName("투표자 구독: 보이지 않는 이벤트는 하트비트로 바꾸고, 해제되면 세션을 정상 종료한다")
    void relay_VoterStream() {
        // given
        when(webSocketSender.sendEventToSession(eq(SESSION_ID), any())).thenReturn(true);
        RoomSubscription subscription = eventBus.subscribe(ROOM_ID);
        when(sessionManager.detachSubscription(SESSION_ID, subscription)).thenReturn(true);

        eventBus.publish(ROOM_ID, RoomEvent.newVoter("v2"));
        eventBus.publish(ROOM_ID, RoomEvent.newVoterCount(2));
        eventBus.publish(ROOM_ID, RoomEvent.voteStarted(List.of("Pizza", "Sushi"), Set.of("v1")));
        eventBus.publish(ROOM_ID, RoomEvent.voteEnded(List.of(new TallyEntry("Pizza", 2), new TallyEntry("Sushi", 1))));
        eventBus.teardown(ROOM_ID);

        // when
        relay.relay(SESSION_ID, SubscriberRole.voter("v1"), subscription);

        // then
        assertEquals(List.of("HEARTBEAT", "VOTER_COUNT", "BALLOT_FORM", "VOTE_RESULT"), sentEvents(4));
        verify(sessionManager).detachSubscription(SESSION_ID, subscription);
        verify(sessionManager).closeSession(SESSION_ID, CloseStatus.NORMAL);
    }

    @Test
    @DisplayName("관리자 구독은 같은 이벤트를 관리자용으로 받는다")
    void relay_AdminStream() {
        when(webSocketSender.sendEventToSession(eq(SESSION_ID), any())).thenReturn(true);
        RoomSubscription subscription = eventBus.subscribe(ROOM_ID);

        eventBus.publish(ROOM_ID, RoomEvent.newVoter("v2"));
        eventBus.publish(ROOM_ID, RoomEvent.voterApproved("v2"));
        eventBus.publish(ROOM_ID, RoomEvent.voteStartable());
        eventBus.teardown(ROOM_ID);

        relay.relay(SESSION_ID, SubscriberRole.admin(ROOM_ID), subscription);

        assertEquals(List.of("VOTER_JOINED", "VOTER_APPROVED", "VOTE_STARTABLE"), sentEvents(3));
    }

    @Test
    @DisplayName("이벤트가 없으면 하트비트 간격마다 하트비트를 보낸다")
    void relay_IdleHeartbeat() {
        // given
        RoomSubscription subscription = eventBus.subscribe(ROOM_ID);
        // 첫 하트비트 이후 연결이 끊긴 것으로 처리
        when(webSocketSender.sendEventToSession(eq(SESSION_ID), any())).thenReturn(true, false);

        // when
        relay.relay(SESSION_ID, SubscriberRole.anonymous(), subscription);

        // then
        assertEquals(List.of("HEARTBEAT", "HEARTBEAT"), sentEvents(2));
    }

    @Test
    @DisplayName("전송에 실패하면 구독만 닫고 방 채널은 그대로 둔다")
    void relay_SendFailureClosesSubscription() {
        // given
        when(webSocketSender.sendEventToSession(eq(SESSION_ID), any())).thenReturn(false);
        RoomSubscription subscription = eventBus.subscribe(ROOM_ID);
        RoomSubscription other = eventBus.subscribe(ROOM_ID);
        eventBus.publish(ROOM_ID, RoomEvent.newVoterCount(1));

        // when
        relay.relay(SESSION_ID, SubscriberRole.voter("v1"), subscription);

        // then
        assertTrue(subscription.isClosed());
        assertFalse(other.isClosed());
        assertEquals(1, eventBus.subscriberCount(ROOM_ID));
        verify(sessionManager).detachSubscription(SESSION_ID, subscription);
        verify(sessionManager, never()).closeSession(any(), any());
    }

    @Test
    @DisplayName("같은 세션에서 다시 구독하면 이전 릴레이는 세션을 닫지 않고 끝난다")
    void relay_ReplacedSubscriptionKeepsSession() throws Exception {
        // given
        WebSocketSession session = mock(WebSocketSession.class);
        lenient().when(session.getId()).thenReturn(SESSION_ID);
        lenient().when(session.isOpen()).thenReturn(true);

        WebSocketSessionManager realManager = new WebSocketSessionManager();
        realManager.registerSession(session);
        RoomStreamRelay realRelay = new RoomStreamRelay(
                new RoomEventProjector(), webSocketSender, realManager, new OrdoProperties(3600, 1, 8, 32));

        RoomSubscription first = eventBus.subscribe(ROOM_ID);
        RoomSubscription second = eventBus.subscribe("room-2");
        realManager.attachSubscription(SESSION_ID, first);
        realManager.attachSubscription(SESSION_ID, second);

        // when
        realRelay.relay(SESSION_ID, SubscriberRole.anonymous(), first);

        // then
        assertTrue(first.isClosed());
        assertFalse(second.isClosed());
        verify(webSocketSender, never()).sendEventToSession(any(), any());
        verify(session, never()).close(any());
    }

    @Test
    @DisplayName("걸려 있는 구독의 방이 해제되면 세션을 정상 종료한다")
    void relay_TeardownClosesAttachedSession() throws Exception {
        // given
        WebSocketSession session = mock(WebSocketSession.class);
        lenient().when(session.getId()).thenReturn(SESSION_ID);
        lenient().when(session.isOpen()).thenReturn(true);

        WebSocketSessionManager realManager = new WebSocketSessionManager();
        realManager.registerSession(session);
        RoomStreamRelay realRelay = new RoomStreamRelay(
                new RoomEventProjector(), webSocketSender, realManager, new OrdoProperties(3600, 1, 8, 32));

        RoomSubscription subscription = eventBus.subscribe(ROOM_ID);
        realManager.attachSubscription(SESSION_ID, subscription);
        eventBus.teardown(ROOM_ID);

        // when
        realRelay.relay(SESSION_ID, SubscriberRole.anonymous(), subscription);

        // then
        verify(session).close(CloseStatus.NORMAL);
    }
}
