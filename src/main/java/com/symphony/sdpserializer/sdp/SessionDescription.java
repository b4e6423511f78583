package com.symphony.sdpserializer.sdp;

import com.symphony.sdpserializer.sdp.objects.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents an SDP offer or answer. {@link #toString()} produces the wire format.
 */
public class SessionDescription {
    public int version;
    public Origin origin;
    public String sessionName;
    public Time time;
    public MsidSemantic msidSemantic;
    public List<Group> groups;
    public List<MediaDescription> mediaDescriptions;

    public SessionDescription() {
        this.version = 0;
        this.origin = new Origin("-", "0", 0, Types.Net.IN, Types.Address.IP4, Connection.ANY_ADDRESS);
        this.sessionName = "-";
        this.time = new Time(0, 0);
        this.msidSemantic = null;
        this.groups = new ArrayList<>();
        this.mediaDescriptions = new ArrayList<>();
    }

    @Override
    public String toString() {
        final StringBuilder stringBuilder = new StringBuilder(16384);

        stringBuilder.append("v=");
        stringBuilder.append(version);
        stringBuilder.append("\r\n");

        stringBuilder.append(origin.toString());
        stringBuilder.append("s=");
        stringBuilder.append(sessionName);
        stringBuilder.append("\r\n");

        if (time != null) {
            stringBuilder.append(time.toString());
        }

        if (msidSemantic != null) {
            stringBuilder.append(msidSemantic.toString());
        }

        for (Group group : groups) {
            stringBuilder.append(group.toString());
        }

        for (MediaDescription mediaDescription : mediaDescriptions) {
            stringBuilder.append(mediaDescription.toString());
        }

        return stringBuilder.toString();
    }
}
