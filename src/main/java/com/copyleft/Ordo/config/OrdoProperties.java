package com.copyleft.Ordo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ordo.room")
public record OrdoProperties(
        // 시간 설정 (초 단위)
        int ttlSeconds,        // 방 생성 후 자동 삭제까지
        int heartbeatSeconds,  // 구독 스트림 하트비트 간격

        // 채널 설정
        int channelCapacity,   // 구독자별 이벤트 버퍼 크기

        // 보안 토큰
        int secretBytes        // admin/voter 비밀값 바이트 수
) {}
