package com.symphony.sdpserializer.sdp;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * One a=candidate line. Addresses and ports are written exactly as given.
 */
public class Candidate {
    public enum Type {
        HOST, SRFLX, PRFLX, RELAY;

        @JsonCreator
        public static Type fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "host":
                    return HOST;
                case "srflx":
                    return SRFLX;
                case "prflx":
                    return PRFLX;
                case "relay":
                    return RELAY;
                default:
                    throw new SessionDescriptionException("Unknown candidate type " + value);
            }
        }

        @Override
        public String toString() {
            switch (this) {
                case HOST:
                    return "host";
                case SRFLX:
                    return "srflx";
                case PRFLX:
                    return "prflx";
                case RELAY:
                    return "relay";
                default:
                    return null;
            }
        }
    }

    public enum TcpType {
        ACTIVE, PASSIVE, SO;

        @JsonCreator
        public static TcpType fromString(String value) throws SessionDescriptionException {
            switch (value) {
                case "active":
                    return ACTIVE;
                case "passive":
                    return PASSIVE;
                case "so":
                    return SO;
                default:
                    throw new SessionDescriptionException("Unknown tcp type " + value);
            }
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static final String DEFAULT_GENERATION = "0";

    public String foundation;
    public int component;
    public String transportType;
    public long priority;
    public String address;
    public String port;
    public Type type;
    public String remoteAddress;
    public String remotePort;
    public TcpType tcpType;
    public String generation;

    public Candidate(
            String foundation,
            int component,
            String transportType,
            long priority,
            String address,
            String port,
            Type type)
    {
        this.foundation = foundation;
        this.component = component;
        this.transportType = transportType;
        this.priority = priority;
        this.address = address;
        this.port = port;
        this.type = type;
        this.remoteAddress = null;
        this.remotePort = null;
        this.tcpType = null;
        this.generation = null;
    }

    @Override
    public String toString() {
        final String protocol = transportType.toUpperCase(Locale.ROOT);

        final StringBuilder stringBuilder = new StringBuilder(512);
        stringBuilder.append("a=candidate:");
        stringBuilder.append(foundation);
        stringBuilder.append(" ");
        stringBuilder.append(component);
        stringBuilder.append(" ");
        stringBuilder.append(protocol);
        stringBuilder.append(" ");
        stringBuilder.append(priority);
        stringBuilder.append(" ");
        stringBuilder.append(address);
        stringBuilder.append(" ");
        stringBuilder.append(port);
        stringBuilder.append(" typ ");
        stringBuilder.append(type.toString());

        if (type != Type.HOST && remoteAddress != null && remotePort != null) {
            stringBuilder.append(" raddr ");
            stringBuilder.append(remoteAddress);
            stringBuilder.append(" rport ");
            stringBuilder.append(remotePort);
        }

        if (tcpType != null && protocol.equals("TCP")) {
            stringBuilder.append(" tcptype ");
            stringBuilder.append(tcpType.toString());
        }

        // generation is always the last token
        stringBuilder.append(" generation ");
        stringBuilder.append(generation != null ? generation : DEFAULT_GENERATION);

        stringBuilder.append("\r\n");

        return stringBuilder.toString();
    }
}
