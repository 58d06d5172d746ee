package com.copyleft.Ordo.feature.broadcast;

/**
 * 구독 스트림에서 꺼낸 한 단위.
 * LAGGED와 IDLE은 오류가 아니라 하트비트/재동기화 계기로 취급한다.
 */
public record SubscriptionSignal(Kind kind, RoomEvent event, long missed) {

    public enum Kind {
        EVENT,   // 이벤트 수신
        LAGGED,  // 버퍼 초과로 일부 이벤트 유실
        IDLE,    // 대기 시간 동안 이벤트 없음
        CLOSED   // 채널 해제, 스트림 종료
    }

    private static final SubscriptionSignal IDLE_SIGNAL = new SubscriptionSignal(Kind.IDLE, null, 0);
    private static final SubscriptionSignal CLOSED_SIGNAL = new SubscriptionSignal(Kind.CLOSED, null, 0);

    public static SubscriptionSignal event(RoomEvent event) {
        return new SubscriptionSignal(Kind.EVENT, event, 0);
    }

    public static SubscriptionSignal lagged(long missed) {
        return new SubscriptionSignal(Kind.LAGGED, null, missed);
    }

    public static SubscriptionSignal idle() {
        return IDLE_SIGNAL;
    }

    public static SubscriptionSignal closed() {
        return CLOSED_SIGNAL;
    }
}
