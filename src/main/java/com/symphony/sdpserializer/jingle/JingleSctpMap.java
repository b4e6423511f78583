package com.symphony.sdpserializer.jingle;

public class JingleSctpMap {
    public int number;
    public String protocol;
    public Integer streams;

    @SuppressWarnings("unused")
    public JingleSctpMap() {
        this.number = 0;
        this.protocol = null;
        this.streams = null;
    }

    public JingleSctpMap(int number, String protocol, Integer streams) {
        this.number = number;
        this.protocol = protocol;
        this.streams = streams;
    }
}
