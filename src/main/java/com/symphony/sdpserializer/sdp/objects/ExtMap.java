package com.symphony.sdpserializer.sdp.objects;

public class ExtMap {
    public int id;
    public Types.Senders direction;
    public String value;

    public ExtMap(int id, Types.Senders direction, String value) {
        this.id = id;
        this.direction = direction;
        this.value = value;
    }

    @Override
    public String toString() {
        final StringBuilder stringBuilder = new StringBuilder();
        stringBuilder.append("a=extmap:");
        stringBuilder.append(id);

        if (direction != null) {
            stringBuilder.append("/");
            stringBuilder.append(direction.toString());
        }

        stringBuilder.append(" ");
        stringBuilder.append(value);
        stringBuilder.append("\r\n");

        return stringBuilder.toString();
    }
}
