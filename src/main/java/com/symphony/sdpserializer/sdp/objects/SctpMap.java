package com.symphony.sdpserializer.sdp.objects;

public class SctpMap {
    public int number;
    public String app;
    public Integer streams;

    public SctpMap(int number, String app, Integer streams) {
        this.number = number;
        this.app = app;
        this.streams = streams;
    }

    @Override
    public String toString() {
        String result = "a=sctpmap:" + number +
                " " +
                app;

        if (streams != null) {
            result += " " + streams.toString();
        }

        return result + "\r\n";
    }
}
