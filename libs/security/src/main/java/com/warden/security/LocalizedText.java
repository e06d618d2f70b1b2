package com.warden.security;

/**
 * A human-readable message in a given locale.
 *
 * @param locale BCP 47 language tag (e.g., "en-US")
 * @param text   the message text
 */
public record LocalizedText(String locale, String text) {

    @Override
    public String toString() {
        return text;
    }
}
