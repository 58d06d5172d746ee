package com.copyleft.Ordo.feature.broadcast;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 하나의 브로드캐스트 채널. 모든 이벤트 종류가 한 채널로 흐르고,
 * 역할별 투영은 구독자 쪽에서 한다.
 */
@Slf4j
class RoomChannel {

    @Getter
    private final String roomId;
    private final int capacity;
    private final Set<RoomSubscription> subscribers = ConcurrentHashMap.newKeySet();

    private volatile boolean closed = false;

    RoomChannel(String roomId, int capacity) {
        this.roomId = roomId;
        this.capacity = capacity;
    }

    RoomSubscription subscribe() {
        RoomSubscription subscription = new RoomSubscription(roomId, capacity, subscribers::remove);
        subscribers.add(subscription);

        // 해제와 동시에 들어온 구독은 바로 종료시킨다
        if (closed) {
            subscription.close();
        }
        return subscription;
    }

    /**
     * @return 이벤트를 받은 구독자 수. 0이면 이벤트는 그대로 버려진다.
     */
    int send(RoomEvent event) {
        int delivered = 0;
        for (RoomSubscription subscription : subscribers) {
            subscription.offer(event);
            delivered++;
        }
        return delivered;
    }

    void close() {
        closed = true;
        for (RoomSubscription subscription : subscribers) {
            subscription.close();
        }
        subscribers.clear();
        log.debug("채널 종료: room={}", roomId);
    }

    int subscriberCount() {
        return subscribers.size();
    }
}
