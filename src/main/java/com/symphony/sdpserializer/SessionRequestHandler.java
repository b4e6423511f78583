package com.symphony.sdpserializer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.symphony.sdpserializer.sdp.SessionDescriptionException;
import com.symphony.sdpserializer.sdp.SessionDescriptionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Entry point to the service. Turns a Jingle session posted as JSON into an SDP session description.
 */
@RestController public final class SessionRequestHandler
{
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRequestHandler.class);

    private final SessionDescriptionFactory sessionDescriptionFactory;
    private final ObjectMapper objectMapper;

    @Autowired public SessionRequestHandler(SessionDescriptionFactory sessionDescriptionFactory)
    {
        this.sessionDescriptionFactory = sessionDescriptionFactory;
        this.objectMapper = new ObjectMapper()
                                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @RequestMapping(value = "/sessions/sdp",
        method = RequestMethod.POST,
        produces = MediaType.APPLICATION_JSON_VALUE)
    @CrossOrigin
    public ResponseEntity<String>
    handleSerialize(@RequestBody String message)
    {
        try
        {
            final var request = objectMapper.readValue(message, SerializeRequest.class);
            if (request == null)
            {
                throw new SessionDescriptionException("Empty request");
            }

            final var options = request.toOptions();
            LOGGER.info("Serialize {} as {}", request.getTypeOrDefault(), options);

            final var sdp = sessionDescriptionFactory.toSdp(request.session, options);
            final var response = new SdpMessage(request.getTypeOrDefault(), sdp);
            return new ResponseEntity<>(objectMapper.writeValueAsString(response), HttpStatus.OK);
        }
        catch (JsonProcessingException | SessionDescriptionException e)
        {
            LOGGER.info("Rejected session description: {}", e.getMessage());
            return new ResponseEntity<>(HttpStatus.BAD_REQUEST);
        }
        catch (Exception e)
        {
            LOGGER.error("Unhandled error", e);
            return new ResponseEntity<>(HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }
}
