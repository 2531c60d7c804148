package io.docgraph.processing.dto.text;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Half-open character range [begin, end) into a text.
 */
public record TextSpan(
        @JsonProperty("begin") int begin,
        @JsonProperty("end") int end
) implements Comparable<TextSpan> {

    public TextSpan {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid span [" + begin + ", " + end + ")");
        }
    }

    @JsonIgnore
    public int length() {
        return end - begin;
    }

    public boolean overlaps(TextSpan other) {
        return begin < other.end && other.begin < end;
    }

    public int overlapLength(TextSpan other) {
        return Math.max(0, Math.min(end, other.end) - Math.max(begin, other.begin));
    }

    public TextSpan shift(int offset) {
        return new TextSpan(begin + offset, end + offset);
    }

    @Override
    public int compareTo(TextSpan other) {
        int byBegin = Integer.compare(begin, other.begin);
        return byBegin != 0 ? byBegin : Integer.compare(end, other.end);
    }
}
