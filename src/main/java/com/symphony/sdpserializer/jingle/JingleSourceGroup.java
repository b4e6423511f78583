package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class JingleSourceGroup {
    public String semantics;
    public List<String> sources = new ArrayList<>();

    @SuppressWarnings("unused")
    public JingleSourceGroup() {
        this.semantics = null;
    }

    public JingleSourceGroup(String semantics, String... sources) {
        this.semantics = semantics;
        this.sources.addAll(Arrays.asList(sources));
    }
}
