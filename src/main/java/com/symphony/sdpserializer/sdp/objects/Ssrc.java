package com.symphony.sdpserializer.sdp.objects;

import java.util.ArrayList;
import java.util.List;

/**
 * All a=ssrc lines of one source, one line per attribute in insertion order.
 */
public class Ssrc
{
    public static class Attribute
    {
        public final String name;
        public final String value;

        public Attribute(String name, String value)
        {
            this.name = name;
            this.value = value;
        }
    }

    public String ssrc;
    public List<Attribute> attributes;

    public Ssrc(String ssrc)
    {
        this.ssrc = ssrc;
        this.attributes = new ArrayList<>();
    }

    public String toString()
    {
        final StringBuilder stringBuilder = new StringBuilder();

        for (Attribute attribute : attributes)
        {
            stringBuilder.append("a=ssrc:");
            stringBuilder.append(ssrc);
            stringBuilder.append(" ");
            stringBuilder.append(attribute.name);
            if (attribute.value != null)
            {
                stringBuilder.append(":");
                stringBuilder.append(attribute.value);
            }
            stringBuilder.append("\r\n");
        }

        return stringBuilder.toString();
    }
}
