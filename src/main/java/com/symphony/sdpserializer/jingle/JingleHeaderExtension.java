package com.symphony.sdpserializer.jingle;

import com.symphony.sdpserializer.sdp.objects.Types;

public class JingleHeaderExtension {
    public int id;
    public String uri;
    public Types.Senders senders;

    @SuppressWarnings("unused")
    public JingleHeaderExtension() {
        this.id = 0;
        this.uri = null;
        this.senders = null;
    }

    public JingleHeaderExtension(int id, String uri, Types.Senders senders) {
        this.id = id;
        this.uri = uri;
        this.senders = senders;
    }
}
