package com.symphony.sdpserializer.sdp.objects;

public class Bandwidth {
    public String modifier;
    public String value;

    public Bandwidth(String modifier, String value) {
        this.modifier = modifier;
        this.value = value;
    }

    @Override
    public String toString() {
        return "b=" +
                modifier +
                ":" +
                value +
                "\r\n";
    }
}
