package com.sommerph.farewellbackend.util;

import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MailHeaderUtilsTest {

    private static final String RAW = String.join("\r\n",
            "From: sender@farewell.world",
            "To: a@x.com",
            "DKIM-Signature: v=1; a=rsa-sha256; d=farewell.world;",
            "\ts=selector1; bh=abc=;",
            "Subject: hi",
            "",
            "DKIM-Signature: this is body text");

    @Test
    void findsHeaderCaseInsensitivelyAndUnfoldsContinuation() {
        assertEquals(Optional.of("v=1; a=rsa-sha256; d=farewell.world; s=selector1; bh=abc=;"),
                MailHeaderUtils.findHeader(RAW, "dkim-signature"));
        assertEquals(Optional.of("hi"), MailHeaderUtils.findHeader(RAW, "Subject"));
    }

    @Test
    void ignoresBodyAndMissingHeaders() {
        assertTrue(MailHeaderUtils.findHeader("Subject: x\n\nDKIM-Signature: y", "DKIM-Signature").isEmpty());
        assertTrue(MailHeaderUtils.findHeader(null, "Subject").isEmpty());
    }

    @Test
    void matchesUnderTurkishDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(Optional.of("v=1"),
                    MailHeaderUtils.findHeader("dkim-signature: v=1\r\n\r\nbody", "DKIM-Signature"));
            assertEquals(Optional.of("v=1"),
                    MailHeaderUtils.findHeader("DKIM-SIGNATURE: v=1\r\n\r\nbody", "dkim-signature"));
        } finally {
            Locale.setDefault(previous);
        }
    }

}
