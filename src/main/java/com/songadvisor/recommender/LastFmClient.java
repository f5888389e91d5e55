package com.songadvisor.recommender;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Music data provider backed by the Last.fm 2.0 REST API.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Builds a GET query with the method name, {@code api_key}, {@code autocorrect=1} and {@code format=json}.</li>
 *   <li>Sends it with the JDK {@link HttpClient} and parses the body into a Jackson tree.</li>
 *   <li>Maps {@code track.getInfo}, {@code artist.getSimilar}, {@code artist.getTopTracks} and
 *       {@code track.getTopTags} payloads to {@link TrackInfo} records and name lists.</li>
 * </ul>
 * <p>
 * Error handling:
 * <ul>
 *   <li>A non-200 status, an {@code error} member in the payload, unparseable JSON, I/O failure or
 *       interruption all raise {@link ProviderException}. Nothing is retried here.</li>
 *   <li>Last.fm returns a bare object instead of a one-element array for single results; both shapes are accepted.</li>
 *   <li>Counts arrive as strings; missing or malformed counts read as 0.</li>
 * </ul>
 *
 * @author Song Advisor Team
 * @since 1.0
 */
public class LastFmClient implements MusicDataProviderInterface {
    private static final Logger logger = LoggerFactory.getLogger(LastFmClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> NAMED_TRACK_FIELDS = Set.of("name", "artist", "listeners", "duration", "playcount", "url");

    private final LastFmConfig config;
    private final HttpClient httpClient;

    public LastFmClient(LastFmConfig config) {
        this(config, HttpClient.newHttpClient());
    }

    public LastFmClient(LastFmConfig config, HttpClient httpClient) {
        if (config == null) {
            throw new IllegalArgumentException("LastFmConfig cannot be null");
        }
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String track) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", artist);
        params.put("track", track);
        JsonNode root = request("track.getInfo", params);
        JsonNode node = root.path("track");
        if (node.isMissingNode() || !node.isObject()) {
            throw new ProviderException("No track info returned for " + artist + " - " + track);
        }
        return parseTrack(node);
    }

    @Override
    public List<String> getSimilarArtists(String artist, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", artist);
        params.put("limit", Integer.toString(limit));
        JsonNode root = request("artist.getSimilar", params);
        List<String> names = new ArrayList<>();
        for (JsonNode node : asList(root.path("similarartists").path("artist"))) {
            String name = node.path("name").asText("");
            if (!name.isBlank()) names.add(name);
        }
        logger.debug("{} similar artists for '{}'", names.size(), artist);
        return names;
    }

    @Override
    public TrackInfo getTopTrack(String artist) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", artist);
        params.put("limit", "1");
        JsonNode root = request("artist.getTopTracks", params);
        List<JsonNode> tracks = asList(root.path("toptracks").path("track"));
        if (tracks.isEmpty()) {
            throw new ProviderException("No top track found for artist " + artist);
        }
        return parseTrack(tracks.get(0));
    }

    @Override
    public List<String> getTopTags(String artist, String track, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("artist", artist);
        params.put("track", track);
        params.put("limit", Integer.toString(limit));
        return parseTagNames(request("track.getTopTags", params));
    }

    /**
     * Performs one API call and returns the parsed payload.
     */
    JsonNode request(String method, Map<String, String> params) {
        URI uri = buildUri(method, params);
        logger.debug("Last.fm request: {} {}", method, params);
        HttpRequest request = HttpRequest.newBuilder().uri(uri).header("User-Agent", config.userAgent()).GET().build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("An error occurred when communicating with the server: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted while calling " + method, e);
        }
        if (response.statusCode() != 200) {
            throw new ProviderException("An error occurred when communicating with the server: " + response.statusCode() + " " + method);
        }
        return parseBody(method, response.body());
    }

    URI buildUri(String method, Map<String, String> params) {
        StringBuilder query = new StringBuilder(config.baseUrl());
        query.append(config.baseUrl().contains("?") ? '&' : '?');
        query.append("method=").append(encode(method));
        for (Map.Entry<String, String> entry : params.entrySet()) {
            query.append('&').append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
        }
        query.append("&api_key=").append(encode(config.apiKey()));
        query.append("&autocorrect=1&format=json");
        return URI.create(query.toString());
    }

    static JsonNode parseBody(String method, String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new ProviderException("Unreadable response for " + method + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ProviderException("Empty response for " + method);
        }
        if (root.has("error")) {
            throw new ProviderException("Last.fm error " + root.path("error").asInt() + " for " + method + ": " + root.path("message").asText(""));
        }
        return root;
    }

    /**
     * Maps a Last.fm track object to a {@link TrackInfo}. The artist may be an object with a
     * {@code name} member or, in some listings, a plain string.
     */
    static TrackInfo parseTrack(JsonNode node) {
        JsonNode artistNode = node.path("artist");
        String artist = artistNode.isObject() ? artistNode.path("name").asText(null) : artistNode.asText(null);
        String name = node.path("name").asText(null);
        if (artist == null || artist.isBlank() || name == null || name.isBlank()) {
            throw new ProviderException("Track record without artist or name: " + node);
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!NAMED_TRACK_FIELDS.contains(field.getKey())) {
                extras.put(field.getKey(), MAPPER.convertValue(field.getValue(), new TypeReference<Object>() {}));
            }
        }
        String url = node.path("url").asText(null);
        return new TrackInfo(artist, name,
            parseCount(node.path("listeners")),
            parseCount(node.path("duration")),
            parseCount(node.path("playcount")),
            url == null || url.isBlank() ? null : url,
            extras);
    }

    static List<String> parseTagNames(JsonNode root) {
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : asList(root.path("toptags").path("tag"))) {
            String name = tag.path("name").asText("");
            if (!name.isBlank()) tags.add(name);
        }
        return tags;
    }

    static long parseCount(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return 0L;
        if (node.isNumber()) return node.asLong();
        try {
            return Long.parseLong(node.asText("").trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static List<JsonNode> asList(JsonNode node) {
        List<JsonNode> items = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(items::add);
        } else if (node.isObject()) {
            items.add(node);
        }
        return items;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
