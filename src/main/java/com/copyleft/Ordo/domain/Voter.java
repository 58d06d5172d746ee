package com.copyleft.Ordo.domain;

import com.copyleft.Ordo.infra.persistence.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.List;

// 승인과 투표 저장은 VoterRepository의 조건부 update로만 한다
@Entity
@Table(name = "voters")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@ToString
public class Voter {

    @Id
    private String id;

    @Column(nullable = false)
    private String roomId;

    @ToString.Exclude
    @Column(nullable = false)
    private String voterSecret;

    private boolean approved;

    // 제출 전에는 null
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> ballot;

    @Column(nullable = false)
    private LocalDateTime joinedAt;

    public static Voter create(String id, String roomId, String voterSecret) {
        return Voter.builder()
                .id(id)
                .roomId(roomId)
                .voterSecret(voterSecret)
                .approved(false)
                .joinedAt(LocalDateTime.now())
                .build();
    }

    public boolean hasBallot() {
        return this.ballot != null;
    }

    public boolean isOwnedBy(String secret) {
        if (secret == null || this.voterSecret == null) {
            return false;
        }
        return MessageDigest.isEqual(
                this.voterSecret.getBytes(StandardCharsets.UTF_8),
                secret.getBytes(StandardCharsets.UTF_8));
    }
}
