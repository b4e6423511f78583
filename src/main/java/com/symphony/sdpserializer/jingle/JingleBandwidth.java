package com.symphony.sdpserializer.jingle;

public class JingleBandwidth {
    public String type;
    public String bandwidth;

    @SuppressWarnings("unused")
    public JingleBandwidth() {
        this.type = null;
        this.bandwidth = null;
    }

    public JingleBandwidth(String type, String bandwidth) {
        this.type = type;
        this.bandwidth = bandwidth;
    }
}
