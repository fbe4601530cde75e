package io.facegate.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Inbound client message: {@code {"action": ..., "token": ..., "events": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ClientMessage {
    public static final String AUTHENTICATE = "authenticate";
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String HEARTBEAT = "heartbeat";
    public static final String PING = "ping";

    public String action;
    public String token;    // authenticate only
    public List<String> events;
}
