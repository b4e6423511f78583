package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.List;

public class JinglePayload {
    public String id;
    public String name;
    public int clockrate;
    public Integer channels;
    public List<JingleParameter> parameters = new ArrayList<>();
    public List<JingleFeedback> feedback = new ArrayList<>();

    @SuppressWarnings("unused")
    public JinglePayload() {
        this.id = null;
        this.name = null;
        this.clockrate = 0;
        this.channels = null;
    }

    public JinglePayload(String id, String name, int clockrate, Integer channels) {
        this.id = id;
        this.name = name;
        this.clockrate = clockrate;
        this.channels = channels;
    }
}
