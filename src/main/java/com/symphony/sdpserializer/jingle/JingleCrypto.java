package com.symphony.sdpserializer.jingle;

public class JingleCrypto {
    public String tag;
    public String cipherSuite;
    public String keyParams;
    public String sessionParams;

    @SuppressWarnings("unused")
    public JingleCrypto() {
        this.tag = null;
        this.cipherSuite = null;
        this.keyParams = null;
        this.sessionParams = null;
    }

    public JingleCrypto(String tag, String cipherSuite, String keyParams, String sessionParams) {
        this.tag = tag;
        this.cipherSuite = cipherSuite;
        this.keyParams = keyParams;
        this.sessionParams = sessionParams;
    }
}
