package com.symphony.sdpserializer.sdp;

import com.symphony.sdpserializer.sdp.objects.Types.Direction;
import com.symphony.sdpserializer.sdp.objects.Types.Role;
import com.symphony.sdpserializer.sdp.objects.Types.Senders;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SendersTableTest {
    private static final EnumSet<Senders> JINGLE_SENDERS =
            EnumSet.of(Senders.INITIATOR, Senders.RESPONDER, Senders.BOTH, Senders.NONE);

    @ParameterizedTest
    @CsvSource({
            "INITIATOR, INCOMING, INITIATOR, RECV_ONLY",
            "INITIATOR, INCOMING, RESPONDER, SEND_ONLY",
            "INITIATOR, INCOMING, BOTH, SEND_RECV",
            "INITIATOR, INCOMING, NONE, INACTIVE",
            "INITIATOR, INCOMING, RECV_ONLY, INITIATOR",
            "INITIATOR, INCOMING, SEND_ONLY, RESPONDER",
            "INITIATOR, INCOMING, SEND_RECV, BOTH",
            "INITIATOR, INCOMING, INACTIVE, NONE",
            "INITIATOR, OUTGOING, INITIATOR, SEND_ONLY",
            "INITIATOR, OUTGOING, RESPONDER, RECV_ONLY",
            "INITIATOR, OUTGOING, BOTH, SEND_RECV",
            "INITIATOR, OUTGOING, NONE, INACTIVE",
            "INITIATOR, OUTGOING, RECV_ONLY, RESPONDER",
            "INITIATOR, OUTGOING, SEND_ONLY, INITIATOR",
            "INITIATOR, OUTGOING, SEND_RECV, BOTH",
            "INITIATOR, OUTGOING, INACTIVE, NONE",
            "RESPONDER, INCOMING, INITIATOR, SEND_ONLY",
            "RESPONDER, INCOMING, RESPONDER, RECV_ONLY",
            "RESPONDER, INCOMING, BOTH, SEND_RECV",
            "RESPONDER, INCOMING, NONE, INACTIVE",
            "RESPONDER, INCOMING, RECV_ONLY, RESPONDER",
            "RESPONDER, INCOMING, SEND_ONLY, INITIATOR",
            "RESPONDER, INCOMING, SEND_RECV, BOTH",
            "RESPONDER, INCOMING, INACTIVE, NONE",
            "RESPONDER, OUTGOING, INITIATOR, RECV_ONLY",
            "RESPONDER, OUTGOING, RESPONDER, SEND_ONLY",
            "RESPONDER, OUTGOING, BOTH, SEND_RECV",
            "RESPONDER, OUTGOING, NONE, INACTIVE",
            "RESPONDER, OUTGOING, RECV_ONLY, INITIATOR",
            "RESPONDER, OUTGOING, SEND_ONLY, RESPONDER",
            "RESPONDER, OUTGOING, SEND_RECV, BOTH",
            "RESPONDER, OUTGOING, INACTIVE, NONE"
    })
    void resolvesEveryEntry(Role role, Direction direction, Senders senders, Senders expected) {
        assertEquals(expected, SendersTable.resolve(role, direction, senders));
    }

    @Test
    void coversEveryCombination() {
        assertEquals(Role.values().length * Direction.values().length * Senders.values().length, SendersTable.size());
    }

    @Test
    void swappingRoleAndDirectionGivesSameKeyword() {
        for (Senders senders : Senders.values()) {
            assertEquals(SendersTable.resolve(Role.INITIATOR, Direction.OUTGOING, senders),
                    SendersTable.resolve(Role.RESPONDER, Direction.INCOMING, senders));
            assertEquals(SendersTable.resolve(Role.INITIATOR, Direction.INCOMING, senders),
                    SendersTable.resolve(Role.RESPONDER, Direction.OUTGOING, senders));
        }
    }

    @Test
    void reverseLookupRestoresJingleSenders() {
        for (Role role : Role.values()) {
            for (Direction direction : Direction.values()) {
                for (Senders senders : JINGLE_SENDERS) {
                    final Senders keyword = SendersTable.resolve(role, direction, senders);
                    assertEquals(senders, SendersTable.resolve(role, direction, keyword));
                }
            }
        }
    }

    @Test
    void keywordsUseSdpSpelling() {
        assertEquals("sendonly", SendersTable.resolve(Role.INITIATOR, Direction.OUTGOING, Senders.INITIATOR).toString());
        assertEquals("recvonly", SendersTable.resolve(Role.RESPONDER, Direction.OUTGOING, Senders.INITIATOR).toString());
    }
}
