package com.nayem.tether.client;

/**
 * Which kind of identifier the mutations are keyed by. Decides the endpoint and
 * the field naming the identifier in the request body.
 */
public enum AudienceType {
    CHANNEL("api/channels/mutations", "channel_id"),
    NAMED_USER("api/named_users/mutations", "named_user_id");

    private final String path;
    private final String audienceKey;

    AudienceType(String path, String audienceKey) {
        this.path = path;
        this.audienceKey = audienceKey;
    }

    public String path() {
        return path;
    }

    public String audienceKey() {
        return audienceKey;
    }
}
