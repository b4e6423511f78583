package com.symphony.sdpserializer.sdp.objects;

public class RtcpFb {
    public static final String TRR_INT = "trr-int";

    public String type;
    public String subtype;
    public String value;

    public RtcpFb(String type, String subtype, String value) {
        this.type = type;
        this.subtype = subtype;
        this.value = value;
    }

    public String toString(String payloadType) {
        final String result = "a=rtcp-fb:" +
                payloadType +
                " " +
                type;

        // trr-int carries its interval instead of a subtype
        if (TRR_INT.equals(type)) {
            return result + " " + (value != null ? value : "0") + "\r\n";
        }

        if (subtype != null) {
            return result + " " + subtype + "\r\n";
        }

        return result + "\r\n";
    }
}
