package com.symphony.sdpserializer.sdp.objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.symphony.sdpserializer.sdp.Candidate;
import com.symphony.sdpserializer.sdp.SessionDescriptionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents an m-line in a SessionDescription. Attribute lines are written in the order WebRTC peers expect, not in
 * field order.
 */
public class MediaDescription {
    public enum Type {
        AUDIO, VIDEO, APPLICATION;

        @JsonCreator
        public static Type fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "audio":
                    return AUDIO;
                case "video":
                    return VIDEO;
                case "application":
                    return APPLICATION;
                default:
                    throw new SessionDescriptionException("Unknown media type " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case AUDIO:
                    return "audio";
                case VIDEO:
                    return "video";
                case APPLICATION:
                    return "application";
                default:
                    throw new AssertionError();
            }
        }
    }

    /**
     * The rtpmap, fmtp and rtcp-fb lines of one payload type. Ids are not required to be unique.
     */
    public static class Payload {
        public String id;
        public RtpMap rtpMap;
        public String fmtp;
        public List<RtcpFb> rtcpFbs;

        public Payload(String id, RtpMap rtpMap) {
            this.id = id;
            this.rtpMap = rtpMap;
            this.fmtp = null;
            this.rtcpFbs = new ArrayList<>();
        }

        @Override
        public String toString() {
            final StringBuilder stringBuilder = new StringBuilder();

            if (rtpMap != null) {
                stringBuilder.append(rtpMap.toString(id));
            }

            if (fmtp != null) {
                stringBuilder.append("a=fmtp:");
                stringBuilder.append(id);
                stringBuilder.append(" ");
                stringBuilder.append(fmtp);
                stringBuilder.append("\r\n");
            }

            for (RtcpFb rtcpFb : rtcpFbs) {
                stringBuilder.append(rtcpFb.toString(id));
            }

            return stringBuilder.toString();
        }
    }

    public static final String PROTOCOL_DTLS_SRTP = "UDP/TLS/RTP/SAVPF";
    public static final String PROTOCOL_SDES_SRTP = "RTP/SAVPF";
    public static final String PROTOCOL_RTP = "RTP/AVPF";
    public static final String PROTOCOL_DTLS_SCTP = "DTLS/SCTP";

    public Type type;
    public int port;
    public String protocol;
    public List<Payload> payloads;
    public List<String> applicationParameters;

    public Connection connection;
    public Bandwidth bandwidth;
    public Rtcp rtcp;

    public Ice ice;
    public List<Fingerprint> fingerprints;
    public List<SctpMap> sctpMaps;

    public Types.Senders direction;
    public String mid;
    public String msid;
    public boolean rtcpMux;
    public boolean rtcpRsize;
    public List<Crypto> cryptos;
    public boolean conferenceFlag;

    public List<RtcpFb> rtcpFbWildcards;

    public List<ExtMap> headerExtensions;
    public List<SsrcGroup> ssrcGroups;
    public List<Ssrc> ssrcs;
    public List<Candidate> candidates;

    public MediaDescription() {
        this.type = null;
        this.port = 0;
        this.protocol = null;
        this.payloads = new ArrayList<>();
        this.applicationParameters = new ArrayList<>();
        this.connection = null;
        this.bandwidth = null;
        this.rtcp = null;
        this.ice = null;
        this.fingerprints = new ArrayList<>();
        this.sctpMaps = new ArrayList<>();
        this.direction = null;
        this.mid = null;
        this.msid = null;
        this.rtcpMux = false;
        this.rtcpRsize = false;
        this.cryptos = new ArrayList<>();
        this.conferenceFlag = false;
        this.rtcpFbWildcards = new ArrayList<>();
        this.headerExtensions = new ArrayList<>();
        this.ssrcGroups = new ArrayList<>();
        this.ssrcs = new ArrayList<>();
        this.candidates = new ArrayList<>();
    }

    @Override
    public String toString() {
        final StringBuilder stringBuilder = new StringBuilder(4096);

        appendMLine(stringBuilder);

        if (connection != null) {
            stringBuilder.append(connection.toString());
        }

        if (bandwidth != null) {
            stringBuilder.append(bandwidth.toString());
        }

        if (rtcp != null) {
            stringBuilder.append(rtcp.toString());
        }

        if (ice != null) {
            stringBuilder.append(ice.toString());
        }

        for (Fingerprint fingerprint : fingerprints) {
            stringBuilder.append(fingerprint.toString());
        }

        for (SctpMap sctpMap : sctpMaps) {
            stringBuilder.append(sctpMap.toString());
        }

        if (direction != null) {
            stringBuilder.append("a=");
            stringBuilder.append(direction.toString());
            stringBuilder.append("\r\n");
        }

        if (mid != null) {
            stringBuilder.append("a=mid:");
            stringBuilder.append(mid);
            stringBuilder.append("\r\n");
        }

        if (msid != null) {
            stringBuilder.append("a=msid:");
            stringBuilder.append(msid);
            stringBuilder.append("\r\n");
        }

        if (rtcpMux) {
            stringBuilder.append("a=rtcp-mux\r\n");
        }

        if (rtcpRsize) {
            stringBuilder.append("a=rtcp-rsize\r\n");
        }

        for (Crypto crypto : cryptos) {
            stringBuilder.append(crypto.toString());
        }

        if (conferenceFlag) {
            stringBuilder.append("a=x-google-flag:conference\r\n");
        }

        for (Payload payload : payloads) {
            stringBuilder.append(payload.toString());
        }

        for (RtcpFb rtcpFb : rtcpFbWildcards) {
            stringBuilder.append(rtcpFb.toString("*"));
        }

        for (ExtMap extMap : headerExtensions) {
            stringBuilder.append(extMap.toString());
        }

        for (SsrcGroup ssrcGroup : ssrcGroups) {
            stringBuilder.append(ssrcGroup.toString());
        }

        for (Ssrc ssrc : ssrcs) {
            stringBuilder.append(ssrc.toString());
        }

        for (Candidate candidate : candidates) {
            stringBuilder.append(candidate.toString());
        }

        return stringBuilder.toString();
    }

    private void appendMLine(StringBuilder stringBuilder) {
        stringBuilder.append("m=");
        stringBuilder.append(type.toString());
        stringBuilder.append(" ");
        stringBuilder.append(port);
        stringBuilder.append(" ");
        stringBuilder.append(protocol);

        if (type == Type.APPLICATION) {
            for (String applicationParameter : applicationParameters) {
                stringBuilder.append(" ");
                stringBuilder.append(applicationParameter);
            }
        } else {
            for (Payload payload : payloads) {
                stringBuilder.append(" ");
                stringBuilder.append(payload.id);
            }
        }

        stringBuilder.append("\r\n");
    }
}
