package com.copyleft.Ordo.feature.broadcast.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
public class SubscribeRequest {
    private String roomId;

    // 둘 다 선택 사항: 없거나 틀리면 익명 구독
    private String adminSecret;
    private String voterId;
    private String voterSecret;
}
