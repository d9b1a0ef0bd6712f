package com.example.photostatus.server.service;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recent photo status events per user, kept so a reconnecting client can catch up on what it
 * missed. The store is in-memory and per instance.
 */
@Service
@Slf4j
public class PhotoEventHistory {

    private static final Pattern NUMERIC_TIMESTAMP = Pattern.compile("^\\d{9,17}$");
    private static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private final Cache<String, Deque<HistoryEntry>> cache;
    private final int maxEntries;
    private final int maxReplay;
    private final Clock clock;

    public PhotoEventHistory(Cache<String, Deque<HistoryEntry>> photoEventHistoryCache,
                             AppProperties appProperties,
                             Clock clock) {
        this.cache = photoEventHistoryCache;
        this.maxEntries = appProperties.getHistory().getMaxEntries();
        this.maxReplay = appProperties.getHistory().getMaxReplay();
        this.clock = clock;
    }

    /**
     * Records a deliverable update, evicting the oldest entries beyond the per-user limit.
     *
     * @return false if the update was not deliverable and nothing was stored
     */
    public boolean append(PhotoStatusUpdate update) {
        if (update == null || !update.isDeliverable()) {
            return false;
        }
        long timestamp = parseTimestampMs(update.getUpdatedAt()).orElseGet(clock::millis);
        HistoryEntry entry = new HistoryEntry(update.toBuilder().build(), timestamp);
        cache.asMap().compute(update.getUserId(), (userId, existing) -> {
            Deque<HistoryEntry> entries = existing != null ? existing : new ArrayDeque<>();
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
            return entries;
        });
        return true;
    }

    /**
     * Events for the user strictly after {@code since}, oldest first and capped at the replay
     * limit (most recent kept).
     *
     * <p>{@code since} is either a timestamp (epoch seconds or millis, or ISO-8601) or an event id.
     * An unknown event id replays everything retained; a blank value does too.
     */
    public List<PhotoStatusUpdate> getCatchupEvents(String userId, String since) {
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        List<HistoryEntry> entries = new ArrayList<>();
        cache.asMap().computeIfPresent(userId, (key, existing) -> {
            entries.addAll(existing);
            return existing;
        });
        entries.sort(Comparator.comparingLong(HistoryEntry::getTimestampMs));

        List<HistoryEntry> filtered = entries;
        String trimmed = since == null ? "" : since.trim();
        if (!trimmed.isEmpty()) {
            OptionalLong cutoff = parseTimestampMs(trimmed);
            if (cutoff.isPresent()) {
                long cutoffMs = cutoff.getAsLong();
                filtered = entries.stream()
                        .filter(entry -> entry.getTimestampMs() > cutoffMs)
                        .collect(Collectors.toList());
            } else {
                int index = indexOfEventId(entries, trimmed);
                if (index >= 0) {
                    filtered = entries.subList(index + 1, entries.size());
                }
            }
        }

        if (filtered.size() > maxReplay) {
            filtered = filtered.subList(filtered.size() - maxReplay, filtered.size());
        }
        return filtered.stream().map(HistoryEntry::getUpdate).collect(Collectors.toList());
    }

    public long getTrackedUserCount() {
        return cache.estimatedSize();
    }

    static OptionalLong parseTimestampMs(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalLong.empty();
        }
        String value = raw.trim();
        if (NUMERIC_TIMESTAMP.matcher(value).matches()) {
            long number = Long.parseLong(value);
            return OptionalLong.of(number > MILLIS_THRESHOLD ? number : number * 1000L);
        }
        try {
            return OptionalLong.of(OffsetDateTime.parse(value).toInstant().toEpochMilli());
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }

    private static int indexOfEventId(List<HistoryEntry> entries, String eventId) {
        for (int i = 0; i < entries.size(); i++) {
            if (eventId.equals(entries.get(i).getUpdate().getEventId())) {
                return i;
            }
        }
        return -1;
    }

    @Value
    public static class HistoryEntry {
        PhotoStatusUpdate update;
        long timestampMs;
    }
}
