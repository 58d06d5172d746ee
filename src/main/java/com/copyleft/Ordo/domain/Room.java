package com.copyleft.Ordo.domain;

import com.copyleft.Ordo.domain.type.RoomStatus;
import com.copyleft.Ordo.infra.persistence.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

// 상태 전이는 RoomRepository.updateStatus로만 한다
@Entity
@Table(name = "rooms")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString
public class Room {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    // 생성자가 입력한 순서 그대로 저장 (표시용)
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4000)
    private List<String> options;

    @ToString.Exclude
    @Column(nullable = false)
    private String adminSecret;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RoomStatus status;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    public static Room create(String id, String name, List<String> options, String adminSecret) {
        return Room.builder()
                .id(id)
                .name(name)
                .options(new ArrayList<>(options))
                .adminSecret(adminSecret)
                .status(RoomStatus.OPEN)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 비교용 정렬 뷰. 저장된 표시 순서는 건드리지 않는다.
     */
    public List<String> getCanonicalOptions() {
        List<String> canonical = new ArrayList<>(this.options);
        canonical.sort(null);
        return canonical;
    }

    /**
     * 투표 항목의 다중집합이 방 항목과 같은지 확인 (순서 무관)
     */
    public boolean acceptsBallot(List<String> ballot) {
        if (ballot == null || ballot.size() != this.options.size()) {
            return false;
        }
        List<String> sorted = new ArrayList<>(ballot);
        if (sorted.contains(null)) {
            return false;
        }
        sorted.sort(null);
        return sorted.equals(getCanonicalOptions());
    }

    public boolean isAdmin(String secret) {
        if (secret == null || this.adminSecret == null) {
            return false;
        }
        return MessageDigest.isEqual(
                this.adminSecret.getBytes(StandardCharsets.UTF_8),
                secret.getBytes(StandardCharsets.UTF_8));
    }
}
