package com.symphony.sdpserializer.sdp;

import com.symphony.sdpserializer.jingle.*;
import com.symphony.sdpserializer.sdp.objects.*;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds SessionDescriptions from Jingle sessions. All input is read only; every call builds a new description, so a
 * single instance can be shared between threads.
 */
@Component public class SessionDescriptionFactory
{
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionDescriptionFactory.class);

    private static final int PLACEHOLDER_PORT = 1;
    private static final String MSID = "msid";

    public SessionDescriptionFactory() {}

    public String toSdp(JingleSession session, SerializerOptions options) throws SessionDescriptionException
    {
        return makeSessionDescription(session, options).toString();
    }

    public SessionDescription makeSessionDescription(JingleSession session, SerializerOptions options)
        throws SessionDescriptionException
    {
        if (session == null)
        {
            throw new SessionDescriptionException("Missing session");
        }

        if (options.time != null && options.time < 0)
        {
            throw new SessionDescriptionException("Negative session version " + options.time);
        }

        final var contents = orEmpty(session.contents);
        final var now = System.currentTimeMillis();

        final var description = new SessionDescription();
        description.origin.sessionId = options.sid != null ? options.sid
            : session.sid != null ? session.sid
            : Long.toString(now);
        description.origin.sessionVersion = options.time != null ? options.time : now;

        var hasSources = false;
        final var contentNames = new HashSet<String>();
        for (final var content : contents)
        {
            if (content == null)
            {
                throw new SessionDescriptionException("Null content in session");
            }
            if (content.application != null && !orEmpty(content.application.sources).isEmpty())
            {
                hasSources = true;
            }
            contentNames.add(content.name);
        }

        if (hasSources)
        {
            description.msidSemantic = new MsidSemantic("WMS");
            description.msidSemantic.ids.add("*");
        }

        for (final var jingleGroup : orEmpty(session.groups))
        {
            if (jingleGroup == null)
            {
                throw new SessionDescriptionException("Null group in session");
            }
            final var group = new Group(jingleGroup.semantics);
            for (final var name : orEmpty(jingleGroup.contents))
            {
                if (!contentNames.contains(name))
                {
                    throw new SessionDescriptionException(
                        "Group " + jingleGroup.semantics + " references unknown content " + name);
                }
                group.mids.add(name);
            }
            description.groups.add(group);
        }

        for (final var content : contents)
        {
            description.mediaDescriptions.add(makeMediaDescription(content, options));
        }

        LOGGER.debug("Session {} with {} contents, {}", description.origin.sessionId, contents.size(), options);
        return description;
    }

    public MediaDescription makeMediaDescription(JingleContent content, SerializerOptions options)
        throws SessionDescriptionException
    {
        if (content.name == null)
        {
            throw new SessionDescriptionException("Content without name");
        }

        final var application = content.application;
        final var transport = content.transport;
        if (application == null || application.applicationType == null)
        {
            throw new SessionDescriptionException("Content " + content.name + " has no application type");
        }
        if (transport == null)
        {
            throw new SessionDescriptionException("Content " + content.name + " has no transport");
        }

        final var isRtp = application.applicationType == JingleApplication.ApplicationType.RTP;
        final var fingerprints = orEmpty(transport.fingerprints);

        final var media = new MediaDescription();
        media.port = PLACEHOLDER_PORT;
        if (isRtp)
        {
            if (application.media == null)
            {
                throw new SessionDescriptionException("Content " + content.name + " has no media type");
            }
            media.type = application.media;

            if (!fingerprints.isEmpty())
            {
                media.protocol = MediaDescription.PROTOCOL_DTLS_SRTP;
            }
            else if (!orEmpty(application.encryption).isEmpty())
            {
                media.protocol = MediaDescription.PROTOCOL_SDES_SRTP;
            }
            else
            {
                media.protocol = MediaDescription.PROTOCOL_RTP;
            }
        }
        else
        {
            media.type = MediaDescription.Type.APPLICATION;
            media.protocol = MediaDescription.PROTOCOL_DTLS_SCTP;

            final var sctpMaps = !orEmpty(transport.sctp).isEmpty() ? transport.sctp : orEmpty(application.sctp);
            for (final var sctpMap : sctpMaps)
            {
                media.applicationParameters.add(Integer.toString(sctpMap.number));
            }
        }

        media.connection = Connection.anyAddress();

        final var bandwidth = application.bandwidth;
        if (bandwidth != null && isSet(bandwidth.type) && isSet(bandwidth.bandwidth))
        {
            media.bandwidth = new Bandwidth(bandwidth.type, bandwidth.bandwidth);
        }

        if (isRtp)
        {
            media.rtcp = new Rtcp(PLACEHOLDER_PORT, Connection.anyAddress());
        }

        if (isSet(transport.ufrag) || isSet(transport.pwd))
        {
            media.ice = new Ice(isSet(transport.ufrag) ? transport.ufrag : null,
                isSet(transport.pwd) ? transport.pwd : null);
        }

        // one a=setup per m-line, taken from the first fingerprint that has one
        var setupAdded = false;
        for (final var jingleFingerprint : fingerprints)
        {
            final var fingerprint = new Fingerprint(jingleFingerprint.hash, jingleFingerprint.value);
            if (!setupAdded && jingleFingerprint.setup != null)
            {
                fingerprint.setup = jingleFingerprint.setup;
                setupAdded = true;
            }
            media.fingerprints.add(fingerprint);
        }

        for (final var sctpMap : orEmpty(transport.sctp))
        {
            media.sctpMaps.add(new SctpMap(sctpMap.number, sctpMap.protocol, sctpMap.streams));
        }

        if (isRtp)
        {
            media.direction = content.senders == null
                ? Types.Senders.SEND_RECV
                : SendersTable.resolve(options.role, options.direction, content.senders);
        }

        media.mid = content.name;
        media.msid = findStreamId(application);

        if (isRtp)
        {
            media.rtcpMux = application.mux;
            media.rtcpRsize = application.rsize;
        }

        for (final var crypto : orEmpty(application.encryption))
        {
            media.cryptos.add(new Crypto(crypto.tag,
                crypto.cipherSuite,
                crypto.keyParams,
                isSet(crypto.sessionParams) ? crypto.sessionParams : null));
        }

        media.conferenceFlag = application.googConferenceFlag;

        if (isRtp)
        {
            addPayloadTypes(media, application);
        }

        for (final var feedback : orEmpty(application.feedback))
        {
            media.rtcpFbWildcards.add(makeRtcpFb(feedback));
        }

        for (final var headerExtension : orEmpty(application.headerExtensions))
        {
            final var direction = headerExtension.senders == null
                ? null
                : SendersTable.resolve(options.role, options.direction, headerExtension.senders);
            media.headerExtensions.add(new ExtMap(headerExtension.id, direction, headerExtension.uri));
        }

        for (final var sourceGroup : orEmpty(application.sourceGroups))
        {
            final var ssrcGroup = new SsrcGroup(sourceGroup.semantics);
            ssrcGroup.ssrcs.addAll(orEmpty(sourceGroup.sources));
            media.ssrcGroups.add(ssrcGroup);
        }

        for (final var source : orEmpty(application.sources))
        {
            final var ssrc = new Ssrc(source.ssrc != null ? source.ssrc : application.ssrc);
            for (final var parameter : orEmpty(source.parameters))
            {
                ssrc.attributes.add(new Ssrc.Attribute(parameter.key, isSet(parameter.value) ? parameter.value : null));
            }
            media.ssrcs.add(ssrc);
        }

        for (final var jingleCandidate : orEmpty(transport.candidates))
        {
            media.candidates.add(makeCandidate(jingleCandidate));
        }

        return media;
    }

    private void addPayloadTypes(MediaDescription media, JingleApplication application)
    {
        for (final var jinglePayload : orEmpty(application.payloads))
        {
            final var payload = new MediaDescription.Payload(jinglePayload.id,
                new RtpMap(jinglePayload.name, jinglePayload.clockrate, jinglePayload.channels));

            final var parameters = orEmpty(jinglePayload.parameters);
            if (!parameters.isEmpty())
            {
                final var fmtpsStringBuilder = new StringBuilder();
                for (final var parameter : parameters)
                {
                    if (fmtpsStringBuilder.length() > 0)
                    {
                        fmtpsStringBuilder.append(";");
                    }
                    if (isSet(parameter.key))
                    {
                        fmtpsStringBuilder.append(parameter.key);
                        fmtpsStringBuilder.append("=");
                    }
                    fmtpsStringBuilder.append(parameter.value);
                }
                payload.fmtp = fmtpsStringBuilder.toString();
            }

            for (final var feedback : orEmpty(jinglePayload.feedback))
            {
                payload.rtcpFbs.add(makeRtcpFb(feedback));
            }
            media.payloads.add(payload);
        }
    }

    /**
     * @return the msid shared by every source of the application, or null when there is none or more than one.
     */
    private static String findStreamId(JingleApplication application)
    {
        final var streamIds = new LinkedHashSet<String>();
        for (final var source : orEmpty(application.sources))
        {
            for (final var parameter : orEmpty(source.parameters))
            {
                if (MSID.equals(parameter.key))
                {
                    streamIds.add(parameter.value);
                }
            }
        }

        return streamIds.size() == 1 ? streamIds.iterator().next() : null;
    }

    private static RtcpFb makeRtcpFb(JingleFeedback feedback)
    {
        return new RtcpFb(feedback.type,
            isSet(feedback.subtype) ? feedback.subtype : null,
            isSet(feedback.value) ? feedback.value : null);
    }

    private static Candidate makeCandidate(JingleCandidate jingleCandidate) throws SessionDescriptionException
    {
        if (jingleCandidate.protocol == null || jingleCandidate.type == null)
        {
            throw new SessionDescriptionException("Candidate " + jingleCandidate.foundation + " has no protocol or type");
        }

        final var candidate = new Candidate(jingleCandidate.foundation,
            jingleCandidate.component,
            jingleCandidate.protocol,
            jingleCandidate.priority,
            jingleCandidate.ip,
            jingleCandidate.port,
            jingleCandidate.type);
        candidate.remoteAddress = isSet(jingleCandidate.relAddr) ? jingleCandidate.relAddr : null;
        candidate.remotePort = isSet(jingleCandidate.relPort) ? jingleCandidate.relPort : null;
        candidate.tcpType = jingleCandidate.tcpType;
        candidate.generation = isSet(jingleCandidate.generation) ? jingleCandidate.generation : null;
        return candidate;
    }

    private static boolean isSet(String value)
    {
        return value != null && !value.isEmpty();
    }

    private static <T> List<T> orEmpty(List<T> list)
    {
        return list != null ? list : List.of();
    }
}
