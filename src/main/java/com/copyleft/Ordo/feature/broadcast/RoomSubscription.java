package com.copyleft.Ordo.feature.broadcast;

import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 방 채널 구독 하나. 구독 이후에 발행된 이벤트만 받는다.
 *
 * <p>버퍼가 가득 차면 가장 오래된 이벤트를 버리고 유실 수를 센다. 발행자는 절대 막히지 않는다.
 * 채널이 해제되면 남은 이벤트를 모두 꺼낸 뒤 {@link SubscriptionSignal.Kind#CLOSED}를 돌려준다.
 */
public class RoomSubscription implements AutoCloseable {

    @Getter
    private final String roomId;

    private final BlockingQueue<SubscriptionSignal> buffer;
    private final AtomicLong missed = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<RoomSubscription> onClose;

    private volatile boolean finished = false;

    RoomSubscription(String roomId, int capacity, Consumer<RoomSubscription> onClose) {
        this.roomId = roomId;
        // CLOSED 신호 자리 하나를 더 둔다
        this.buffer = new ArrayBlockingQueue<>(capacity + 1);
        this.onClose = onClose;
    }

    void offer(RoomEvent event) {
        SubscriptionSignal signal = SubscriptionSignal.event(event);
        synchronized (buffer) {
            if (closed.get()) {
                return;
            }
            // 마지막 한 칸은 CLOSED 신호용
            while (buffer.remainingCapacity() <= 1) {
                if (buffer.poll() != null) {
                    missed.incrementAndGet();
                }
            }
            buffer.offer(signal);
        }
    }

    /**
     * 다음 신호를 기다린다. timeout 동안 아무것도 없으면 IDLE.
     */
    public SubscriptionSignal next(Duration timeout) throws InterruptedException {
        if (finished) {
            return SubscriptionSignal.closed();
        }

        long lagged = missed.getAndSet(0);
        if (lagged > 0) {
            return SubscriptionSignal.lagged(lagged);
        }

        SubscriptionSignal signal = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (signal == null) {
            return SubscriptionSignal.idle();
        }
        if (signal.kind() == SubscriptionSignal.Kind.CLOSED) {
            finished = true;
        }
        return signal;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 구독 종료. 채널 해제와 구독자 이탈 모두 여기로 온다. 여러 번 호출해도 안전하다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (buffer) {
            buffer.offer(SubscriptionSignal.closed());
        }
        onClose.accept(this);
    }
}
