package com.symphony.sdpserializer.sdp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CandidateTest {
    private static Candidate makeCandidate(String protocol, Candidate.Type type) {
        return new Candidate("4093211373", 1, protocol, 2113937151L, "192.168.1.2", "56143", type);
    }

    @Test
    void hostCandidateDefaultsGeneration() {
        final Candidate candidate = makeCandidate("udp", Candidate.Type.HOST);

        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ host generation 0\r\n",
                candidate.toString());
    }

    @Test
    void hostCandidateNeverCarriesRelatedAddress() {
        final Candidate candidate = makeCandidate("udp", Candidate.Type.HOST);
        candidate.remoteAddress = "10.0.0.1";
        candidate.remotePort = "9";

        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ host generation 0\r\n",
                candidate.toString());
    }

    @Test
    void reflexiveCandidateCarriesRelatedAddress() {
        final Candidate candidate = makeCandidate("udp", Candidate.Type.SRFLX);
        candidate.remoteAddress = "10.0.0.1";
        candidate.remotePort = "9";
        candidate.generation = "2";

        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ srflx raddr 10.0.0.1 rport 9"
                + " generation 2\r\n", candidate.toString());
    }

    @Test
    void relatedAddressNeedsBothFields() {
        final Candidate relay = makeCandidate("udp", Candidate.Type.RELAY);
        relay.remoteAddress = "10.0.0.1";

        final Candidate prflx = makeCandidate("udp", Candidate.Type.PRFLX);
        prflx.remotePort = "9";

        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ relay generation 0\r\n",
                relay.toString());
        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ prflx generation 0\r\n",
                prflx.toString());
    }

    @Test
    void tcpTypeOnlyForTcp() {
        final Candidate tcp = makeCandidate("tcp", Candidate.Type.HOST);
        tcp.tcpType = Candidate.TcpType.ACTIVE;

        final Candidate udp = makeCandidate("UDP", Candidate.Type.HOST);
        udp.tcpType = Candidate.TcpType.PASSIVE;

        assertEquals("a=candidate:4093211373 1 TCP 2113937151 192.168.1.2 56143 typ host tcptype active"
                + " generation 0\r\n", tcp.toString());
        assertEquals("a=candidate:4093211373 1 UDP 2113937151 192.168.1.2 56143 typ host generation 0\r\n",
                udp.toString());
    }

    @Test
    void tcpTypeFollowsRelatedAddress() {
        final Candidate candidate = makeCandidate("Tcp", Candidate.Type.SRFLX);
        candidate.remoteAddress = "10.0.0.1";
        candidate.remotePort = "9";
        candidate.tcpType = Candidate.TcpType.SO;

        assertEquals("a=candidate:4093211373 1 TCP 2113937151 192.168.1.2 56143 typ srflx raddr 10.0.0.1 rport 9"
                + " tcptype so generation 0\r\n", candidate.toString());
    }

    @Test
    void malformedAddressesPassThrough() {
        final Candidate candidate = new Candidate("x", 2, "udp", 1L, "not-an-ip", "not-a-port", Candidate.Type.HOST);

        assertEquals("a=candidate:x 2 UDP 1 not-an-ip not-a-port typ host generation 0\r\n", candidate.toString());
    }
}
