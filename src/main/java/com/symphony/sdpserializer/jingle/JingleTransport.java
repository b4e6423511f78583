package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.List;

/**
 * ICE-UDP transport with DTLS fingerprints and, for data channels, SCTP maps.
 */
public class JingleTransport {
    public String ufrag;
    public String pwd;
    public List<JingleFingerprint> fingerprints = new ArrayList<>();
    public List<JingleCandidate> candidates = new ArrayList<>();
    public List<JingleSctpMap> sctp = new ArrayList<>();
}
