package com.evintel.charging.model;

/**
 * A raw collector record that could not be normalised.
 *
 * @param source    record kind, e.g. "usage_session"
 * @param recordKey best available identifier of the rejected record, may be null
 */
public record Rejection(String source, String recordKey, RejectionReason reason, String detail) {

    @Override
    public String toString() {
        return source + "[" + recordKey + "] " + reason.code() + ": " + detail;
    }
}
