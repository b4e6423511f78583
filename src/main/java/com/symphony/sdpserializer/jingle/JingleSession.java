package com.symphony.sdpserializer.jingle;

import java.util.ArrayList;
import java.util.List;

/**
 * A Jingle session description: bundle groups plus one content per media line.
 */
public class JingleSession {
    public String sid;
    public List<JingleGroup> groups = new ArrayList<>();
    public List<JingleContent> contents = new ArrayList<>();
}
