package com.copyleft.Ordo.feature.room;

import com.copyleft.Ordo.config.OrdoProperties;
import com.copyleft.Ordo.feature.room.event.RoomCreatedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 방 생성 시 고정 TTL 뒤 한 번 실행되는 삭제를 예약한다.
 * 수동 종료와 경쟁하며, 이미 삭제된 방이면 아무 일도 하지 않는다.
 * 실패해도 재시도하지 않고, 재시작 시 예약은 사라진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomExpiryScheduler {

    private final TaskScheduler taskScheduler;
    private final RoomService roomService;
    private final OrdoProperties ordoProperties;

    @EventListener
    public void handleRoomCreated(RoomCreatedEvent event) {
        scheduleExpiry(event.getRoomId());
    }

    public void scheduleExpiry(String roomId) {
        Instant expireAt = Instant.now().plusSeconds(ordoProperties.ttlSeconds());
        taskScheduler.schedule(() -> expire(roomId), expireAt);
        log.info("방 만료 예약: room={}, at={}", roomId, expireAt);
    }

    void expire(String roomId) {
        try {
            boolean deleted = roomService.expire(roomId);
            log.info("방 만료 처리: room={}, 삭제={}", roomId, deleted);
        } catch (Exception e) {
            log.error("방 만료 처리 실패 (재시도 없음): room={}", roomId, e);
        }
    }
}
