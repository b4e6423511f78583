package com.symphony.sdpserializer.sdp.objects;

/**
 * SDES key line, https://tools.ietf.org/html/rfc4568
 */
public class Crypto {
    public String tag;
    public String cipherSuite;
    public String keyParams;
    public String sessionParams;

    public Crypto(String tag, String cipherSuite, String keyParams, String sessionParams) {
        this.tag = tag;
        this.cipherSuite = cipherSuite;
        this.keyParams = keyParams;
        this.sessionParams = sessionParams;
    }

    @Override
    public String toString() {
        String result = "a=crypto:" + tag +
                " " +
                cipherSuite +
                " " +
                keyParams;

        if (sessionParams != null) {
            result += " " + sessionParams;
        }

        return result + "\r\n";
    }
}
