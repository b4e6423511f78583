package com.symphony.sdpserializer.sdp;

/**
 * Thrown when a session description cannot be turned into SDP because the input breaks a caller contract.
 */
public class SessionDescriptionException extends Exception {
    public SessionDescriptionException(String message) {
        super(message);
    }
}
