package com.flagship.prior_auth.integration.insurance.x12;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One X12 segment: an identifier followed by its data elements.
 *
 * Elements are addressed 1-based as in the implementation guides, so
 * {@code element(1)} of {@code HCR*A1*REF123} is {@code A1}.
 */
@Value
public class X12Segment {

    public static final char ELEMENT_SEPARATOR = '*';
    public static final char COMPONENT_SEPARATOR = ':';
    public static final char SEGMENT_TERMINATOR = '~';

    String id;
    List<String> elements;

    public static X12Segment of(String id, String... elements) {
        List<String> values = new ArrayList<>(elements.length);
        for (String element : elements) {
            values.add(sanitize(element));
        }
        return new X12Segment(id, List.copyOf(values));
    }

    /**
     * Composite element such as {@code ABK:E119}.
     */
    public static String composite(String... components) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                out.append(COMPONENT_SEPARATOR);
            }
            out.append(sanitize(components[i]).replace(COMPONENT_SEPARATOR, ' '));
        }
        return out.toString();
    }

    static X12Segment parse(String raw) {
        String[] parts = raw.split("\\" + ELEMENT_SEPARATOR, -1);
        return new X12Segment(parts[0].trim(), List.of(Arrays.copyOfRange(parts, 1, parts.length)));
    }

    /**
     * Element value, or empty string when the segment is shorter.
     */
    public String element(int position) {
        return position >= 1 && position <= elements.size() ? elements.get(position - 1) : "";
    }

    public boolean hasElement(int position) {
        return !element(position).isBlank();
    }

    public String render() {
        StringBuilder out = new StringBuilder(id);
        int last = elements.size();
        while (last > 0 && elements.get(last - 1).isEmpty()) {
            last--;
        }
        for (int i = 0; i < last; i++) {
            out.append(ELEMENT_SEPARATOR).append(elements.get(i));
        }
        return out.append(SEGMENT_TERMINATOR).toString();
    }

    /**
     * Element and segment delimiters inside a value are replaced with spaces.
     */
    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value
                .replace(ELEMENT_SEPARATOR, ' ')
                .replace(SEGMENT_TERMINATOR, ' ')
                .replace('\n', ' ')
                .replace('\r', ' ');
    }
}
