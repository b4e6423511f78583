package com.symphony.sdpserializer.jingle;

import com.symphony.sdpserializer.sdp.Candidate;

public class JingleCandidate {
    public String foundation;
    public int component;
    public String protocol;
    public long priority;
    public String ip;
    public String port;
    public Candidate.Type type;
    public String relAddr;
    public String relPort;
    public Candidate.TcpType tcpType;
    public String generation;
}
