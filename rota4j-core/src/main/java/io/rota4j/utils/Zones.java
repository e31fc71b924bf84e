package io.rota4j.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public final class Zones {
    private static final Logger log = LoggerFactory.getLogger(Zones.class);

    private Zones() {
    }

    /**
     * Resolves an IANA zone id. Blank or unknown ids fall back to UTC with a warning.
     */
    public static ZoneId resolveOrUtc(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("rota invalid timezone, falling back to UTC timezone={} msg={}", timezone, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
