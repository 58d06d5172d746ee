package com.copyleft.Ordo.feature.broadcast;

/**
 * 구독 시점에 한 번 결정되는 구독자 역할.
 * ADMIN이면 id는 roomId, VOTER면 voterId, ANONYMOUS면 null.
 */
public record SubscriberRole(Kind kind, String id) {

    public enum Kind {
        ADMIN,
        VOTER,
        ANONYMOUS
    }

    public static SubscriberRole admin(String roomId) {
        return new SubscriberRole(Kind.ADMIN, roomId);
    }

    public static SubscriberRole voter(String voterId) {
        return new SubscriberRole(Kind.VOTER, voterId);
    }

    public static SubscriberRole anonymous() {
        return new SubscriberRole(Kind.ANONYMOUS, null);
    }

    public boolean isVoter(String voterId) {
        return kind == Kind.VOTER && id != null && id.equals(voterId);
    }
}
