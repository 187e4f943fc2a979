package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.integration.StatusResponse;
import com.flagship.prior_auth.integration.WireCodec;
import com.flagship.prior_auth.integration.WireProtocolException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 278 inquiry for a previously submitted request, keyed by the payer's reference.
 */
public class StatusInquiryCodec implements WireCodec<String, StatusResponse> {

    static final String IMPLEMENTATION_GUIDE = "005010X215";

    private final X12Envelope envelope;
    private final String upstream;

    public StatusInquiryCodec(X12Envelope envelope, String upstream) {
        this.envelope = envelope;
        this.upstream = upstream;
    }

    @Override
    public String encode(String externalReferenceId) {
        LocalDateTime now = envelope.now();
        List<X12Segment> body = List.of(
                X12Segment.of("BHT", "0007", "13", externalReferenceId, X12Envelope.date(now), X12Envelope.time(now)),
                X12Segment.of("HL", "1", "", "20", "1"),
                X12Segment.of("HL", "2", "1", "21", "1"),
                X12Segment.of("NM1", "1P", "2", envelope.getSenderId(), "", "", "", "", "XX", envelope.getSenderId()),
                X12Segment.of("HL", "3", "2", "EV", "0"),
                X12Segment.of("REF", "BB", externalReferenceId));
        return envelope.wrap("HI", "278", IMPLEMENTATION_GUIDE, body);
    }

    @Override
    public StatusResponse decode(String wireMessage) {
        X12Document reply = X12Document.parse(wireMessage).requireTransactionSet("278");
        X12Replies.raiseRejections(reply, upstream);

        X12Segment hcr = reply.first("HCR")
                .orElseThrow(() -> new WireProtocolException("278 inquiry reply carries no HCR review outcome"));
        String reference = hcr.hasElement(2)
                ? hcr.element(2)
                : reply.reference("BB").orElseThrow(() ->
                        new WireProtocolException("278 inquiry reply does not identify the request"));
        String notes = reply.all("MSG").stream()
                .map(msg -> msg.element(1))
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining(" "));

        return X12Replies.HCR_ACTIONS.toStatusResponse(reference, hcr.element(1),
                notes.isEmpty() ? null : notes, wireMessage);
    }

    @Override
    public String contentType() {
        return "application/edi-x12";
    }
}
