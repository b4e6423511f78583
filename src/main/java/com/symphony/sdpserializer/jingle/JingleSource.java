package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.List;

public class JingleSource {
    public String ssrc;
    public List<JingleParameter> parameters = new ArrayList<>();

    @SuppressWarnings("unused")
    public JingleSource() {
        this.ssrc = null;
    }

    public JingleSource(String ssrc) {
        this.ssrc = ssrc;
    }
}
