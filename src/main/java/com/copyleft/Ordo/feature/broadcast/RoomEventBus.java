package com.copyleft.Ordo.feature.broadcast;

import com.copyleft.Ordo.config.OrdoProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * 방별 실시간 알림 채널 관리.
 *
 * <p>채널은 구독 시 지연 생성되고, 투표 종료나 만료 시 {@link #teardown(String)}으로 해제된다.
 * 발행은 채널을 만들지 않는다. 채널이 없으면 구독자도 없으므로 이벤트를 버린다.
 * 맵에 대한 조회/삽입/삭제만 원자적으로 처리하고, 얻어온 채널로의 전송은 락 없이 한다.
 * 구독자가 없을 때 발행된 이벤트는 버려진다 (저장/재전송 없음).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomEventBus {

    private final OrdoProperties ordoProperties;

    private final ConcurrentHashMap<String, RoomChannel> channels = new ConcurrentHashMap<>();

    /**
     * 알림은 부가 동작이므로 여기서 발생한 예외는 호출자에게 전파하지 않는다.
     */
    public void publish(String roomId, RoomEvent event) {
        RoomChannel channel = channels.get(roomId);
        if (channel == null) {
            log.debug("구독자 없음, 이벤트 버림: room={}, type={}", roomId, event.getType());
            return;
        }
        try {
            int delivered = channel.send(event);
            log.debug("이벤트 발행: room={}, type={}, 수신자={}", roomId, event.getType(), delivered);
        } catch (RuntimeException e) {
            log.warn("이벤트 발행 실패 (무시): room={}, type={}", roomId, event.getType(), e);
        }
    }

    public RoomSubscription subscribe(String roomId) {
        RoomSubscription subscription = channelFor(roomId).subscribe();
        log.info("채널 구독: room={}", roomId);
        return subscription;
    }

    /**
     * 채널을 제거하고 모든 구독 스트림을 정상 종료시킨다. 없는 채널이면 아무 일도 하지 않는다.
     */
    public void teardown(String roomId) {
        RoomChannel channel = channels.remove(roomId);
        if (channel == null) {
            return;
        }
        channel.close();
        log.info("채널 해제: room={}", roomId);
    }

    public boolean hasChannel(String roomId) {
        return channels.containsKey(roomId);
    }

    public int subscriberCount(String roomId) {
        RoomChannel channel = channels.get(roomId);
        return channel == null ? 0 : channel.subscriberCount();
    }

    private RoomChannel channelFor(String roomId) {
        return channels.computeIfAbsent(roomId,
                id -> new RoomChannel(id, ordoProperties.channelCapacity()));
    }
}
