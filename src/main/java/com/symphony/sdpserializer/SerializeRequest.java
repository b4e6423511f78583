package com.symphony.sdpserializer;

import com.symphony.sdpserializer.jingle.JingleSession;
import com.symphony.sdpserializer.sdp.SerializerOptions;
import com.symphony.sdpserializer.sdp.objects.Types;

/**
 * Body of a serialize request. Everything but the session is optional.
 */
public class SerializeRequest {
    public static final String DEFAULT_TYPE = "offer";

    public String type;
    public Types.Role role;
    public Types.Direction direction;
    public String sid;
    public Long time;
    public JingleSession session;

    public SerializerOptions toOptions() {
        final var options = new SerializerOptions(role, direction);
        options.sid = sid;
        options.time = time;
        return options;
    }

    public String getTypeOrDefault() {
        return type != null ? type : DEFAULT_TYPE;
    }
}
