package com.symphony.sdpserializer.sdp.objects;

public class RtpMap {
    public String codec;
    public int clockRate;
    public Integer parameter;

    public RtpMap(String codec, int clockRate, Integer parameter) {
        this.codec = codec;
        this.clockRate = clockRate;
        this.parameter = parameter;
    }

    public String toString(String payloadType) {
        final String result = "a=rtpmap:" + payloadType +
                " " +
                codec +
                "/" +
                clockRate;
        if (parameter != null && parameter != 1) {
            return result + "/" + parameter + "\r\n";
        }

        return result + "\r\n";
    }
}
