package com.example.photostatus.server.service;

import com.example.photostatus.server.config.AppProperties;
import com.example.photostatus.server.service.PhotoEventHistory.HistoryEntry;
import com.example.photostatus.shared.dto.PhotoStatusUpdate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PhotoEventHistoryTest {

    private AppProperties properties;
    private PhotoEventHistory history;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        history = newHistory();
    }

    private PhotoEventHistory newHistory() {
        Cache<String, Deque<HistoryEntry>> cache = Caffeine.newBuilder().build();
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:10:00Z"), ZoneOffset.UTC);
        return new PhotoEventHistory(cache, properties, clock);
    }

    private static PhotoStatusUpdate update(String eventId, String updatedAt) {
        return PhotoStatusUpdate.builder()
                .userId("u1")
                .eventId(eventId)
                .photoId("p1")
                .status("processing")
                .updatedAt(updatedAt)
                .build();
    }

    private static List<String> ids(List<PhotoStatusUpdate> updates) {
        return updates.stream().map(PhotoStatusUpdate::getEventId).collect(Collectors.toList());
    }

    private void appendThree() {
        history.append(update("e1", "2024-01-01T00:00:01Z"));
        history.append(update("e2", "2024-01-01T00:00:02Z"));
        history.append(update("e3", "2024-01-01T00:00:03Z"));
    }

    @Test
    void replaysEverythingInChronologicalOrderWithoutSince() {
        history.append(update("e2", "2024-01-01T00:00:02Z"));
        history.append(update("e1", "2024-01-01T00:00:01Z"));

        assertThat(ids(history.getCatchupEvents("u1", null))).containsExactly("e1", "e2");
    }

    @Test
    void replaysStrictlyAfterEpochSecondsCutoff() {
        appendThree();

        // 2024-01-01T00:00:01Z
        assertThat(ids(history.getCatchupEvents("u1", "1704067201"))).containsExactly("e2", "e3");
    }

    @Test
    void replaysAfterEpochMillisAndIsoCutoffs() {
        appendThree();

        assertThat(ids(history.getCatchupEvents("u1", "1704067202000"))).containsExactly("e3");
        assertThat(ids(history.getCatchupEvents("u1", "2024-01-01T00:00:02Z"))).containsExactly("e3");
    }

    @Test
    void replaysAfterKnownEventId() {
        appendThree();

        assertThat(ids(history.getCatchupEvents("u1", "e1"))).containsExactly("e2", "e3");
        assertThat(ids(history.getCatchupEvents("u1", "e3"))).isEmpty();
    }

    @Test
    void unknownEventIdReplaysEverything() {
        appendThree();

        assertThat(ids(history.getCatchupEvents("u1", "never-seen"))).containsExactly("e1", "e2", "e3");
    }

    @Test
    void keepsOnlyMostRecentEntries() {
        properties.getHistory().setMaxEntries(2);
        history = newHistory();
        appendThree();

        assertThat(ids(history.getCatchupEvents("u1", null))).containsExactly("e2", "e3");
    }

    @Test
    void capsReplayToMostRecent() {
        properties.getHistory().setMaxReplay(2);
        history = newHistory();
        appendThree();

        assertThat(ids(history.getCatchupEvents("u1", null))).containsExactly("e2", "e3");
    }

    @Test
    void ignoresUndeliverableUpdatesAndOtherUsers() {
        assertThat(history.append(update("e1", "2024-01-01T00:00:01Z").toBuilder().status("done").build())).isFalse();
        assertThat(history.append(null)).isFalse();
        history.append(update("e2", "2024-01-01T00:00:02Z"));

        assertThat(history.getCatchupEvents("u2", null)).isEmpty();
        assertThat(history.getCatchupEvents(" ", null)).isEmpty();
        assertThat(ids(history.getCatchupEvents("u1", null))).containsExactly("e2");
    }

    @Test
    void parsesSecondsAndMillis() {
        assertThat(PhotoEventHistory.parseTimestampMs("1704067200")).hasValue(1_704_067_200_000L);
        assertThat(PhotoEventHistory.parseTimestampMs("1704067200123")).hasValue(1_704_067_200_123L);
        assertThat(PhotoEventHistory.parseTimestampMs("12345")).isEmpty();
        assertThat(PhotoEventHistory.parseTimestampMs("evt-1")).isEmpty();
    }
}
