package io.vigil.stream;

import io.vigil.model.TranscriptEntry;

import java.util.Map;

/**
 * One delivery on a subscription: either a committed entry, or the terminal gap notice sent when
 * the subscriber fell behind. {@code resumeFrom} maps execution id to the first sequence the
 * subscriber did not receive; re-read from there with a transcript query.
 */
public record StreamItem(Kind kind, TranscriptEntry entry, Map<String, Long> resumeFrom) {
    public enum Kind {
        ENTRY,
        GAP
    }

    public static StreamItem entry(TranscriptEntry entry) {
        return new StreamItem(Kind.ENTRY, entry, Map.of());
    }

    public static StreamItem gap(Map<String, Long> resumeFrom) {
        return new StreamItem(Kind.GAP, null, Map.copyOf(resumeFrom));
    }

    public boolean isGap() {
        return kind == Kind.GAP;
    }
}
