package com.symphony.sdpserializer.sdp;

import com.symphony.sdpserializer.sdp.objects.Types;

/**
 * Per-call settings for {@link SessionDescriptionFactory}. A null sid or time falls back to the session id and the
 * current time.
 */
public class SerializerOptions {
    public static final Types.Role DEFAULT_ROLE = Types.Role.INITIATOR;
    public static final Types.Direction DEFAULT_DIRECTION = Types.Direction.OUTGOING;

    public Types.Role role;
    public Types.Direction direction;
    public String sid;
    public Long time;

    public SerializerOptions() {
        this.role = DEFAULT_ROLE;
        this.direction = DEFAULT_DIRECTION;
        this.sid = null;
        this.time = null;
    }

    public SerializerOptions(Types.Role role, Types.Direction direction) {
        this.role = role != null ? role : DEFAULT_ROLE;
        this.direction = direction != null ? direction : DEFAULT_DIRECTION;
        this.sid = null;
        this.time = null;
    }

    @Override
    public String toString() {
        return "SerializerOptions{" + "role=" + role + ", direction=" + direction + ", sid=" + sid + ", time=" + time +
                "}";
    }
}
