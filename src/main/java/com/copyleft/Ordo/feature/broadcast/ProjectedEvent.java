package com.copyleft.Ordo.feature.broadcast;

import com.copyleft.Ordo.global.constant.SocketEvent;

/**
 * 특정 구독자에게 보낼 투영 결과. 직렬화 방식은 전송 계층이 정한다.
 */
public record ProjectedEvent(SocketEvent event, Object data) {

    public static ProjectedEvent of(SocketEvent event, Object data) {
        return new ProjectedEvent(event, data);
    }

    public static ProjectedEvent heartbeat() {
        return new ProjectedEvent(SocketEvent.HEARTBEAT, null);
    }
}
