package com.symphony.sdpserializer;

import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * The shape WebRTC expects for RTCSessionDescriptionInit.
 */
@JsonTypeName("SdpMessage")
public class SdpMessage {
    @SuppressWarnings("unused")
    public SdpMessage() {
        this.type = null;
        this.sdp = null;
    }

    public SdpMessage(String type, String sdp) {
        this.type = type;
        this.sdp = sdp;
    }

    public String type;
    public String sdp;
}
