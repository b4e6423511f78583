package com.symphony.sdpserializer.sdp.objects;

public class Time {
    public int startTime;
    public int stopTime;

    public Time(int startTime, int stopTime) {
        this.startTime = startTime;
        this.stopTime = stopTime;
    }

    @Override
    public String toString() {
        return "t=" + startTime + " " + stopTime + "\r\n";
    }
}
