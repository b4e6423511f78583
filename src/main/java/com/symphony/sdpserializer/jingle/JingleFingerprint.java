package com.symphony.sdpserializer.jingle;

import com.symphony.sdpserializer.sdp.objects.Types;

public class JingleFingerprint {
    public String hash;
    public String value;
    public Types.Setup setup;

    @SuppressWarnings("unused")
    public JingleFingerprint() {
        this.hash = null;
        this.value = null;
        this.setup = null;
    }

    public JingleFingerprint(String hash, String value, Types.Setup setup) {
        this.hash = hash;
        this.value = value;
        this.setup = setup;
    }
}
