package com.symphony.sdpserializer;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SessionRequestHandlerTest {
    private static final String AUDIO_CONTENT = "{\"name\":\"audio\",\"senders\":\"both\","
            + "\"application\":{\"applicationType\":\"rtp\",\"media\":\"audio\",\"mux\":true,"
            + "\"payloads\":[{\"id\":\"111\",\"name\":\"OPUS\",\"clockrate\":48000,\"channels\":2}]},"
            + "\"transport\":{\"ufrag\":\"u\",\"pwd\":\"p\","
            + "\"fingerprints\":[{\"hash\":\"sha-256\",\"value\":\"AB:CD\",\"setup\":\"active\"}],"
            + "\"candidates\":[{\"foundation\":\"1\",\"component\":1,\"protocol\":\"udp\",\"priority\":2113937151,"
            + "\"ip\":\"10.0.0.1\",\"port\":\"5000\",\"type\":\"host\",\"generation\":\"0\"}]}}";

    @Autowired
    private MockMvc mockMvc;

    private static String makeRequest(String role, String content) {
        return "{\"type\":\"answer\",\"role\":\"" + role + "\",\"direction\":\"outgoing\",\"sid\":\"42\",\"time\":7,"
                + "\"session\":{\"groups\":[{\"semantics\":\"BUNDLE\",\"contents\":[\"audio\"]}],"
                + "\"contents\":[" + content + "]}}";
    }

    @Test
    void serializesSession() throws Exception {
        mockMvc.perform(post("/sessions/sdp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(makeRequest("responder", AUDIO_CONTENT)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("answer"))
                .andExpect(jsonPath("$.sdp", startsWith("v=0\r\no=- 42 7 IN IP4 0.0.0.0\r\n")))
                .andExpect(jsonPath("$.sdp", containsString("a=group:BUNDLE audio\r\n")))
                .andExpect(jsonPath("$.sdp", containsString("a=rtpmap:111 OPUS/48000/2\r\n")))
                .andExpect(jsonPath("$.sdp", containsString("a=setup:active\r\n")))
                .andExpect(jsonPath("$.sdp", containsString("a=sendrecv\r\n")))
                .andExpect(jsonPath("$.sdp",
                        containsString("a=candidate:1 1 UDP 2113937151 10.0.0.1 5000 typ host generation 0\r\n")));
    }

    @Test
    void unknownRoleIsBadRequest() throws Exception {
        mockMvc.perform(post("/sessions/sdp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(makeRequest("observer", AUDIO_CONTENT)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void contentWithoutTransportIsBadRequest() throws Exception {
        final String content = "{\"name\":\"audio\","
                + "\"application\":{\"applicationType\":\"rtp\",\"media\":\"audio\"}}";

        mockMvc.perform(post("/sessions/sdp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(makeRequest("initiator", content)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nullContentIsBadRequest() throws Exception {
        mockMvc.perform(post("/sessions/sdp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session\":{\"contents\":[null]}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/sessions/sdp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session\":"))
                .andExpect(status().isBadRequest());
    }
}
