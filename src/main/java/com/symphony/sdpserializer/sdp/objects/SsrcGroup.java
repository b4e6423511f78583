package com.symphony.sdpserializer.sdp.objects;

import java.util.ArrayList;

public class SsrcGroup {
    public String semantics;
    public ArrayList<String> ssrcs;

    public SsrcGroup(String semantics) {
        this.semantics = semantics;
        this.ssrcs = new ArrayList<>();
    }

    @Override
    public String toString() {
        final StringBuilder stringBuilder = new StringBuilder();

        stringBuilder.append("a=ssrc-group:");
        stringBuilder.append(semantics);
        for (String ssrc : ssrcs) {
            stringBuilder.append(" ");
            stringBuilder.append(ssrc);
        }
        stringBuilder.append("\r\n");

        return stringBuilder.toString();
    }
}
