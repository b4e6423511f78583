package com.symphony.sdpserializer.jingle;

public class JingleFeedback {
    public String type;
    public String subtype;
    public String value;

    @SuppressWarnings("unused")
    public JingleFeedback() {
        this.type = null;
        this.subtype = null;
        this.value = null;
    }

    public JingleFeedback(String type, String subtype) {
        this.type = type;
        this.subtype = subtype;
        this.value = null;
    }
}
