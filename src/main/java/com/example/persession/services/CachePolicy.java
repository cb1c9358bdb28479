package com.example.persession.services;

import com.example.persession.models.CacheEvent;
import com.example.persession.models.CacheType;
import org.apache.commons.lang3.time.DurationFormatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides when a cache file may be loaded and when a session has to be written.
 */
public class CachePolicy {
    private static final Logger log = LoggerFactory.getLogger(CachePolicy.class);

    private final Clock clock;

    public CachePolicy() {
        this(Clock.systemDefaultZone());
    }

    public CachePolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * A cache file is usable when its age, now minus its modification time, is strictly
     * less than {@code timeout}. A file exactly {@code timeout} old is expired.
     */
    public boolean shouldLoad(Path cacheFile, Duration timeout) {
        if (!Files.exists(cacheFile)) {
            log.info("Cache file not found");
            return false;
        }
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(cacheFile).toInstant();
        } catch (IOException e) {
            log.info("Cache file modification time unreadable: {}", e.getMessage());
            return false;
        }
        Duration age = Duration.between(modified, clock.instant());
        log.info("Cache file found (last modified {} ago)", describe(age));

        if (age.compareTo(timeout) < 0) {
            return true;
        }
        log.info("Cache expired (older than {})", describe(timeout));
        return false;
    }

    public boolean shouldTriggerSave(CacheType cacheType, CacheEvent event) {
        switch (cacheType) {
            case AFTER_EACH_REQUEST:
                return event.getKind() == CacheEvent.Kind.REQUEST_SENT;
            case AFTER_EACH_POST:
                return event.getKind() == CacheEvent.Kind.REQUEST_SENT && "POST".equalsIgnoreCase(event.getMethod());
            case AFTER_EACH_LOGIN:
                return event.getKind() == CacheEvent.Kind.LOGIN_SUCCEEDED;
            case AT_EXIT:
                return event.getKind() == CacheEvent.Kind.SCOPE_EXIT;
            case MANUAL:
            default:
                return false;
        }
    }

    private static String describe(Duration duration) {
        if (duration.isNegative()) {
            return "-" + DurationFormatUtils.formatDurationWords(duration.negated().toMillis(), true, true);
        }
        return DurationFormatUtils.formatDurationWords(duration.toMillis(), true, true);
    }
}
