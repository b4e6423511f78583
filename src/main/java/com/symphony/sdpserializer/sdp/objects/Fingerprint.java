package com.symphony.sdpserializer.sdp.objects;

/**
 * A DTLS certificate fingerprint. When setup is set, the a=setup line follows the fingerprint line.
 */
public class Fingerprint {
    public String type;
    public String hash;
    public Types.Setup setup;

    public Fingerprint(String type, String hash) {
        this.type = type;
        this.hash = hash;
        this.setup = null;
    }

    @Override
    public String toString() {
        final String result = "a=fingerprint:" + type + " " + hash + "\r\n";

        if (setup != null) {
            return result + "a=setup:" + setup.toString() + "\r\n";
        }

        return result;
    }
}
