package com.sommerph.farewellbackend.util;

import java.util.Locale;
import java.util.Optional;

/**
 * Minimal RFC 5322 header lookup on raw message text. Only the header block (up to the first empty
 * line) is searched, and folded continuation lines are unfolded.
 */
public class MailHeaderUtils {

    private MailHeaderUtils() {}

    public static Optional<String> findHeader(String rawMessage, String headerName) {
        if (rawMessage == null) {
            return Optional.empty();
        }
        String[] lines = rawMessage.split("\\r?\\n", -1);
        String prefix = headerName.toLowerCase(Locale.ROOT) + ":";
        StringBuilder value = null;
        for (String line : lines) {
            if (line.isEmpty()) {
                break;
            }
            boolean continuation = line.charAt(0) == ' ' || line.charAt(0) == '\t';
            if (value != null) {
                if (continuation) {
                    value.append(' ').append(line.strip());
                    continue;
                }
                break;
            }
            if (!continuation && line.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                value = new StringBuilder(line.substring(prefix.length()).strip());
            }
        }
        return Optional.ofNullable(value).map(StringBuilder::toString);
    }

}
