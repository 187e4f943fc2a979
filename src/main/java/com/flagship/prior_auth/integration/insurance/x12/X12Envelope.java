package com.flagship.prior_auth.integration.insurance.x12;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps transaction set bodies in ISA/GS/ST envelopes with increasing control numbers.
 */
public class X12Envelope {

    private static final DateTimeFormatter ISA_DATE = DateTimeFormatter.ofPattern("yyMMdd");
    private static final DateTimeFormatter GS_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmm");

    private final String senderId;
    private final String receiverId;
    private final Clock clock;
    private final AtomicLong controlNumbers = new AtomicLong(System.currentTimeMillis() % 100_000_000L);

    public X12Envelope(String senderId, String receiverId, Clock clock) {
        this.senderId = senderId;
        this.receiverId = receiverId;
        this.clock = clock;
    }

    public String getSenderId() {
        return senderId;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public static String date(LocalDateTime time) {
        return GS_DATE.format(time);
    }

    public static String time(LocalDateTime time) {
        return TIME.format(time);
    }

    /**
     * @param functionalId GS01 functional identifier code (HS for 270, HI for 278)
     * @param transactionSet ST01, e.g. 270
     * @param implementationGuide ST03 / GS08 version, e.g. 005010X217
     * @param body segments between ST and SE
     */
    public String wrap(String functionalId, String transactionSet, String implementationGuide,
                       List<X12Segment> body) {
        long control = controlNumbers.updateAndGet(n -> n >= 999_999_999L ? 1 : n + 1);
        String interchangeControl = String.format("%09d", control);
        String groupControl = Long.toString(control);
        String transactionControl = String.format("%04d", control % 10_000);
        LocalDateTime now = now();

        List<X12Segment> segments = new ArrayList<>();
        segments.add(X12Segment.of("ISA",
                "00", pad("", 10), "00", pad("", 10),
                "ZZ", pad(senderId, 15), "ZZ", pad(receiverId, 15),
                ISA_DATE.format(now), TIME.format(now), "^", "00501", interchangeControl, "0", "P",
                String.valueOf(X12Segment.COMPONENT_SEPARATOR)));
        segments.add(X12Segment.of("GS", functionalId, senderId, receiverId,
                GS_DATE.format(now), TIME.format(now), groupControl, "X", implementationGuide));
        segments.add(X12Segment.of("ST", transactionSet, transactionControl, implementationGuide));
        segments.addAll(body);
        // SE01 counts ST and SE themselves
        segments.add(X12Segment.of("SE", Integer.toString(body.size() + 2), transactionControl));
        segments.add(X12Segment.of("GE", "1", groupControl));
        segments.add(X12Segment.of("IEA", "1", interchangeControl));

        StringBuilder out = new StringBuilder();
        for (X12Segment segment : segments) {
            out.append(segment.render()).append('\n');
        }
        return out.toString();
    }

    private static String pad(String value, int width) {
        String v = value == null ? "" : value;
        if (v.length() >= width) {
            return v.substring(0, width);
        }
        return v + " ".repeat(width - v.length());
    }
}
