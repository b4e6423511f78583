package com.symphony.sdpserializer.sdp.objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.symphony.sdpserializer.sdp.SessionDescriptionException;

public class Types {
    public enum Net {
        IN
    }

    public enum Address {
        IP4, IP6
    }

    /**
     * The local party's role in the Jingle session.
     */
    public enum Role {
        INITIATOR, RESPONDER;

        @JsonCreator
        public static Role fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "initiator":
                    return INITIATOR;
                case "responder":
                    return RESPONDER;
                default:
                    throw new SessionDescriptionException("Unknown role " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case INITIATOR:
                    return "initiator";
                case RESPONDER:
                    return "responder";
                default:
                    throw new AssertionError();
            }
        }
    }

    /**
     * Whether the description being serialized was received from the peer or is about to be sent to it.
     */
    public enum Direction {
        INCOMING, OUTGOING;

        @JsonCreator
        public static Direction fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "incoming":
                    return INCOMING;
                case "outgoing":
                    return OUTGOING;
                default:
                    throw new SessionDescriptionException("Unknown direction " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case INCOMING:
                    return "incoming";
                case OUTGOING:
                    return "outgoing";
                default:
                    throw new AssertionError();
            }
        }
    }

    /**
     * Sender modes. The first four are the Jingle role-relative values, the last four the SDP direction attributes.
     * {@link com.symphony.sdpserializer.sdp.SendersTable} maps each group onto the other.
     */
    public enum Senders {
        INITIATOR, RESPONDER, BOTH, NONE, RECV_ONLY, SEND_ONLY, SEND_RECV, INACTIVE;

        @JsonCreator
        public static Senders fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "initiator":
                    return INITIATOR;
                case "responder":
                    return RESPONDER;
                case "both":
                    return BOTH;
                case "none":
                    return NONE;
                case "recvonly":
                    return RECV_ONLY;
                case "sendonly":
                    return SEND_ONLY;
                case "sendrecv":
                    return SEND_RECV;
                case "inactive":
                    return INACTIVE;
                default:
                    throw new SessionDescriptionException("Unknown senders " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case INITIATOR:
                    return "initiator";
                case RESPONDER:
                    return "responder";
                case BOTH:
                    return "both";
                case NONE:
                    return "none";
                case RECV_ONLY:
                    return "recvonly";
                case SEND_ONLY:
                    return "sendonly";
                case SEND_RECV:
                    return "sendrecv";
                case INACTIVE:
                    return "inactive";
                default:
                    throw new AssertionError();
            }
        }
    }

    public enum Setup {
        ACTIVE, PASSIVE, ACTPASS;

        @JsonCreator
        public static Setup fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "active":
                    return ACTIVE;
                case "passive":
                    return PASSIVE;
                case "actpass":
                    return ACTPASS;
                default:
                    throw new SessionDescriptionException("Unknown setup " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case ACTIVE:
                    return "active";
                case PASSIVE:
                    return "passive";
                case ACTPASS:
                    return "actpass";
                default:
                    return null;
            }
        }
    }

}
