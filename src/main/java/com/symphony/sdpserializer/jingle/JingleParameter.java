package com.symphony.sdpserializer.jingle;

/**
 * A key/value pair. Payload parameters may omit the key, source parameters may omit the value.
 */
public class JingleParameter {
    public String key;
    public String value;

    @SuppressWarnings("unused")
    public JingleParameter() {
        this.key = null;
        this.value = null;
    }

    public JingleParameter(String key, String value) {
        this.key = key;
        this.value = value;
    }
}
