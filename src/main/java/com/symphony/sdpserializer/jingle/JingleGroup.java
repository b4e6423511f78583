package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class JingleGroup {
    public String semantics;
    public List<String> contents = new ArrayList<>();

    @SuppressWarnings("unused")
    public JingleGroup() {
        this.semantics = null;
    }

    public JingleGroup(String semantics, String... contents) {
        this.semantics = semantics;
        this.contents.addAll(Arrays.asList(contents));
    }
}
