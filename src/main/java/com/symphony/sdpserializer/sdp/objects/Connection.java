package com.symphony.sdpserializer.sdp.objects;

public class Connection {
    public static final String ANY_ADDRESS = "0.0.0.0";

    public Types.Net netType;
    public Types.Address addressType;
    public String address;

    public Connection(Types.Net netType, Types.Address addressType, String address) {
        this.netType = netType;
        this.addressType = addressType;
        this.address = address;
    }

    /**
     * The placeholder connection WebRTC peers expect, since real addresses travel in candidates.
     */
    public static Connection anyAddress() {
        return new Connection(Types.Net.IN, Types.Address.IP4, ANY_ADDRESS);
    }

    @Override
    public String toString() {
        return "c=" + toAddressString() + "\r\n";
    }

    String toAddressString() {
        return netType.toString() + " " + addressType.toString() + " " + address;
    }
}
