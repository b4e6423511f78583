package com.symphony.sdpserializer.sdp.objects;

public class Rtcp {
    public int port;
    public Connection connection;

    public Rtcp(int port, Connection connection) {
        this.port = port;
        this.connection = connection;
    }

    @Override
    public String toString() {
        final String result = "a=rtcp:" + port;

        if (connection != null) {
            return result + " " + connection.toAddressString() + "\r\n";
        }

        return result + "\r\n";
    }
}
