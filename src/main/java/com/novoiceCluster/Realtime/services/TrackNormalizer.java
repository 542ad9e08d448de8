package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.config.RealtimeProperties;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.MusicCommand;
import com.novoiceCluster.Realtime.model.SourceKind;
import com.novoiceCluster.Realtime.model.Track;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Builds a {@link Track} from a raw link submitted with {@code music.enqueue}.
 *
 * Only http(s) links are accepted. The source is inferred from the hostname; YouTube links in
 * short, watch, shorts and embed form are reduced to one canonical watch URL, with a thumbnail
 * as cover art when none was supplied.
 */
@Component
@RequiredArgsConstructor
public class TrackNormalizer {

    static final int MAX_LABEL_LENGTH = 180;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FILE_EXTENSION = Pattern.compile("\\.[a-z0-9]{2,5}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATORS = Pattern.compile("[-_]+");
    private static final List<String> YOUTUBE_ID_PATHS = List.of("shorts", "embed", "v");

    private final RealtimeProperties properties;

    public Track normalize(MusicCommand command, Connection requester, Instant now) {
        URI uri = parseHttpUrl(command.getUrl());
        SourceKind source = SourceKind.fromHost(uri.getHost());

        String url = uri.toString();
        String coverUrl = blankToNull(command.getCoverUrl());
        String title = normalizeLabel(command.getTitle(), null);

        if (source == SourceKind.YOUTUBE) {
            String videoId = extractYoutubeVideoId(uri);
            if (videoId == null) {
                throw RealtimeException.validation("Unrecognized YouTube link");
            }
            url = "https://www.youtube.com/watch?v=" + videoId;
            if (coverUrl == null) {
                coverUrl = "https://img.youtube.com/vi/" + videoId + "/hqdefault.jpg";
            }
            if (title == null) {
                title = "YouTube Video";
            }
        }
        if (title == null) {
            title = inferTitle(uri);
        }

        return Track.builder()
                .id(UUID.randomUUID().toString())
                .url(url)
                .title(title)
                .source(source)
                .sourceLabel(source.getLabel())
                .coverUrl(coverUrl)
                .durationSeconds(clampDuration(command.getDurationSeconds()))
                .requestedBy(requester.getUserId())
                .requestedByName(requester.getUsername())
                .addedAt(now)
                .build();
    }

    // ============ URL HANDLING ============

    static URI parseHttpUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw RealtimeException.validation("A link is required");
        }
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw RealtimeException.validation("Not a valid link");
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw RealtimeException.validation("Only http and https links are supported");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw RealtimeException.validation("Not a valid link");
        }
        return uri;
    }

    static String extractYoutubeVideoId(URI uri) {
        String host = uri.getHost().toLowerCase();
        List<String> segments = pathSegments(uri);

        if (host.contains("youtu.be")) {
            return segments.isEmpty() ? null : segments.get(0);
        }
        if (host.contains("youtube.com")) {
            String v = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("v");
            if (v != null && !v.isBlank()) {
                return v;
            }
            if (segments.size() >= 2 && YOUTUBE_ID_PATHS.contains(segments.get(0))) {
                return segments.get(1);
            }
        }
        return null;
    }

    /**
     * Title from the last path segment ("my_song-final.mp3" becomes "my song final"), or the
     * hostname without "www." when the path is empty.
     */
    static String inferTitle(URI uri) {
        List<String> segments = pathSegments(uri);
        String last = segments.isEmpty() ? "" : segments.get(segments.size() - 1);
        String titleLike = SEPARATORS.matcher(FILE_EXTENSION.matcher(last).replaceFirst("")).replaceAll(" ").trim();
        if (titleLike.isEmpty()) {
            titleLike = uri.getHost().replaceFirst("^www\\.", "");
        }
        return normalizeLabel(titleLike, "Untitled");
    }

    private static List<String> pathSegments(URI uri) {
        String path = uri.getPath() == null ? "" : uri.getPath();
        return Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    // ============ VALUE CLEANUP ============

    static String normalizeLabel(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String cleaned = WHITESPACE.matcher(value).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return fallback;
        }
        return cleaned.length() > MAX_LABEL_LENGTH ? cleaned.substring(0, MAX_LABEL_LENGTH) : cleaned;
    }

    Double clampDuration(Double seconds) {
        if (seconds == null || seconds.isNaN() || seconds.isInfinite()) {
            return null;
        }
        double clamped = Math.max(0, Math.min(properties.getMaxPositionSeconds(), seconds));
        return Math.round(clamped * 1000) / 1000.0;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
