package com.symphony.sdpserializer.sdp;

import com.symphony.sdpserializer.sdp.objects.Types.Direction;
import com.symphony.sdpserializer.sdp.objects.Types.Role;
import com.symphony.sdpserializer.sdp.objects.Types.Senders;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps Jingle senders onto SDP direction attributes and back, relative to the local role and to whether the
 * description is incoming or outgoing. Every (role, direction, senders) combination has exactly one entry.
 */
public final class SendersTable {
    private static final class Key {
        final Role role;
        final Direction direction;
        final Senders senders;

        Key(Role role, Direction direction, Senders senders) {
            this.role = role;
            this.direction = direction;
            this.senders = senders;
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Key)) {
                return false;
            }
            final Key other = (Key)obj;

            return role == other.role && direction == other.direction && senders == other.senders;
        }

        @Override
        public int hashCode() {
            return Objects.hash(role, direction, senders);
        }
    }

    private static final Map<Key, Senders> TABLE;

    static {
        final Map<Key, Senders> table = new HashMap<>();

        put(table, Role.INITIATOR, Direction.INCOMING, Senders.INITIATOR, Senders.RECV_ONLY);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.RESPONDER, Senders.SEND_ONLY);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.BOTH, Senders.SEND_RECV);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.NONE, Senders.INACTIVE);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.RECV_ONLY, Senders.INITIATOR);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.SEND_ONLY, Senders.RESPONDER);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.SEND_RECV, Senders.BOTH);
        put(table, Role.INITIATOR, Direction.INCOMING, Senders.INACTIVE, Senders.NONE);

        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.INITIATOR, Senders.SEND_ONLY);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.RESPONDER, Senders.RECV_ONLY);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.BOTH, Senders.SEND_RECV);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.NONE, Senders.INACTIVE);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.RECV_ONLY, Senders.RESPONDER);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.SEND_ONLY, Senders.INITIATOR);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.SEND_RECV, Senders.BOTH);
        put(table, Role.INITIATOR, Direction.OUTGOING, Senders.INACTIVE, Senders.NONE);

        put(table, Role.RESPONDER, Direction.INCOMING, Senders.INITIATOR, Senders.SEND_ONLY);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.RESPONDER, Senders.RECV_ONLY);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.BOTH, Senders.SEND_RECV);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.NONE, Senders.INACTIVE);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.RECV_ONLY, Senders.RESPONDER);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.SEND_ONLY, Senders.INITIATOR);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.SEND_RECV, Senders.BOTH);
        put(table, Role.RESPONDER, Direction.INCOMING, Senders.INACTIVE, Senders.NONE);

        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.INITIATOR, Senders.RECV_ONLY);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.RESPONDER, Senders.SEND_ONLY);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.BOTH, Senders.SEND_RECV);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.NONE, Senders.INACTIVE);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.RECV_ONLY, Senders.INITIATOR);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.SEND_ONLY, Senders.RESPONDER);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.SEND_RECV, Senders.BOTH);
        put(table, Role.RESPONDER, Direction.OUTGOING, Senders.INACTIVE, Senders.NONE);

        TABLE = Collections.unmodifiableMap(table);
    }

    private SendersTable() {}

    public static Senders resolve(Role role, Direction direction, Senders senders) {
        final Senders result = TABLE.get(new Key(role, direction, senders));
        if (result == null) {
            throw new AssertionError("No senders mapping for " + role + "/" + direction + "/" + senders);
        }
        return result;
    }

    static int size() {
        return TABLE.size();
    }

    private static void put(Map<Key, Senders> table, Role role, Direction direction, Senders senders, Senders result) {
        table.put(new Key(role, direction, senders), result);
    }
}
