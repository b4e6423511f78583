package com.symphony.sdpserializer.sdp.objects;

public class Ice {
    public String ufrag;
    public String pwd;

    public Ice(String ufrag, String pwd) {
        this.ufrag = ufrag;
        this.pwd = pwd;
    }

    @Override
    public String toString() {
        String result = "";

        if (ufrag != null) {
            result += "a=ice-ufrag:" + ufrag + "\r\n";
        }

        if (pwd != null) {
            result += "a=ice-pwd:" + pwd + "\r\n";
        }

        return result;
    }
}
