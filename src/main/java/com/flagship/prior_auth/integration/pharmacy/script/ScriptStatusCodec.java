package com.flagship.prior_auth.integration.pharmacy.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.WireCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public class ScriptStatusCodec implements WireCodec<String, StatusResponse> {

    private final ObjectMapper xmlMapper;
    private final String senderId;
    private final String upstream;
    private final Clock clock;

    public ScriptStatusCodec(ObjectMapper xmlMapper, String senderId, String upstream, Clock clock) {
        this.xmlMapper = xmlMapper;
        this.senderId = senderId;
        this.upstream = upstream;
        this.clock = clock;
    }

    @Override
    public String encode(String paReferenceId) {
        PaStatusInquiryMessage inquiry = PaStatusInquiryMessage.builder()
                .header(ScriptHeader.builder()
                        .messageId(UUID.randomUUID().toString())
                        .sentTime(Instant.now(clock))
                        .from(senderId)
                        .build())
                .paReferenceId(paReferenceId)
                .build();
        try {
            return xmlMapper.writeValueAsString(inquiry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render SCRIPT status inquiry", e);
        }
    }

    @Override
    public StatusResponse decode(String wireMessage) {
        PaResponseMessage reply = ScriptReplies.read(xmlMapper, wireMessage, upstream);
        PaResponseMessage.ResponseStatus status = reply.getResponseStatus();
        return ScriptReplies.PA_STATUS.toStatusResponse(reply.getPaReferenceId(), status.getCode(),
                status.getNote(), wireMessage);
    }

    @Override
    public String contentType() {
        return "application/xml";
    }
}
