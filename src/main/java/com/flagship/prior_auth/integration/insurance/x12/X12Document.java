package com.flagship.prior_auth.integration.insurance.x12;

import com.flagship.prior_auth.integration.WireProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed interchange: the flat segment list between and including ISA and IEA.
 * Loops are not modelled; decoders look segments up by identifier.
 */
public final class X12Document {

    private final List<X12Segment> segments;

    private X12Document(List<X12Segment> segments) {
        this.segments = List.copyOf(segments);
    }

    /**
     * @throws WireProtocolException if the payload is empty or has no segments
     */
    public static X12Document parse(String wireMessage) {
        if (wireMessage == null || wireMessage.isBlank()) {
            throw new WireProtocolException("Empty X12 payload");
        }
        List<X12Segment> parsed = new ArrayList<>();
        for (String raw : wireMessage.split(String.valueOf(X12Segment.SEGMENT_TERMINATOR))) {
            String trimmed = raw.strip();
            if (!trimmed.isEmpty()) {
                parsed.add(X12Segment.parse(trimmed));
            }
        }
        if (parsed.isEmpty()) {
            throw new WireProtocolException("X12 payload contains no segments");
        }
        return new X12Document(parsed);
    }

    public List<X12Segment> segments() {
        return segments;
    }

    public Optional<X12Segment> first(String id) {
        return segments.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    public List<X12Segment> all(String id) {
        return segments.stream().filter(s -> s.getId().equals(id)).toList();
    }

    /**
     * First {@code REF} segment with the given qualifier.
     */
    public Optional<String> reference(String qualifier) {
        return all("REF").stream()
                .filter(ref -> ref.element(1).equals(qualifier))
                .map(ref -> ref.element(2))
                .filter(value -> !value.isBlank())
                .findFirst();
    }

    /**
     * Checks the transaction set identifier in ST01.
     *
     * @throws WireProtocolException if ST is missing or names another transaction set
     */
    public X12Document requireTransactionSet(String expected) {
        X12Segment st = first("ST")
                .orElseThrow(() -> new WireProtocolException("X12 payload has no ST segment"));
        if (!expected.equals(st.element(1))) {
            throw new WireProtocolException(
                    "Expected transaction set " + expected + " but received " + st.element(1));
        }
        return this;
    }
}
