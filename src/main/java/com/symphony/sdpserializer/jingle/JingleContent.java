package com.symphony.sdpserializer.jingle;

import com.symphony.sdpserializer.sdp.objects.Types;

public class JingleContent {
    public String name;
    public Types.Senders senders;
    public JingleApplication application;
    public JingleTransport transport;
}
