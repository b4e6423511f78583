package com.symphony.sdpserializer.jingle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.symphony.sdpserializer.sdp.SessionDescriptionException;
import com.symphony.sdpserializer.sdp.objects.MediaDescription;

import java.util.ArrayList;
import java.util.List;

/**
 * The application description of a content. RTP fields and data channel fields share this class, and
 * applicationType decides which of them apply.
 */
public class JingleApplication {
    public enum ApplicationType {
        RTP, DATACHANNEL;

        @JsonCreator
        public static ApplicationType fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "rtp":
                    return RTP;
                case "datachannel":
                    return DATACHANNEL;
                default:
                    throw new SessionDescriptionException("Unknown application type " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case RTP:
                    return "rtp";
                case DATACHANNEL:
                    return "datachannel";
                default:
                    throw new AssertionError();
            }
        }
    }

    public ApplicationType applicationType;
    public MediaDescription.Type media;
    public boolean mux;
    public boolean rsize;
    public JingleBandwidth bandwidth;
    public String ssrc;
    public boolean googConferenceFlag;

    public List<JinglePayload> payloads = new ArrayList<>();
    public List<JingleFeedback> feedback = new ArrayList<>();
    public List<JingleHeaderExtension> headerExtensions = new ArrayList<>();
    public List<JingleSctpMap> sctp = new ArrayList<>();
    public List<JingleSourceGroup> sourceGroups = new ArrayList<>();
    public List<JingleSource> sources = new ArrayList<>();
    public List<JingleCrypto> encryption = new ArrayList<>();
}
