package com.copyleft.Ordo.global.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();

    private RandomUtil() {
    }

    /**
     * UUID 생성 (Room, Voter id용)
     */
    public static String generateId() {
        return UUID.randomUUID().toString();
    }

    /**
     * URL-safe 비밀 토큰 생성 (adminSecret, voterSecret용)
     */
    public static String generateSecret(int byteLength) {
        if (byteLength < 16) {
            throw new IllegalArgumentException("Secret must be at least 16 bytes");
        }
        byte[] bytes = new byte[byteLength];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
