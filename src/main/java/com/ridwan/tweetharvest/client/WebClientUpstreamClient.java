package com.ridwan.tweetharvest.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ridwan.tweetharvest.client.dto.GatewayPageResponse;
import com.ridwan.tweetharvest.client.dto.GatewaySessionResponse;
import com.ridwan.tweetharvest.config.UpstreamConfig;
import com.ridwan.tweetharvest.exception.AuthExpiredException;
import com.ridwan.tweetharvest.exception.HarvestException;
import com.ridwan.tweetharvest.exception.RecordNotFoundException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Talks to a JSON scraping gateway authenticated by a browser cookie string.
 *
 * <ul>
 *   <li>{@code GET /session}: {@code {"authenticated": true, "screen_name": "..."}}
 *   <li>{@code GET /search?q=&cursor=}: {@code {"records": [...], "next_cursor": "..."}}
 *   <li>{@code GET /tweets/{id}}: the raw tweet payload
 * </ul>
 *
 * <p>HTTP errors propagate as {@link WebClientResponseException} so the retry policy can classify
 * them by status.
 */
@Slf4j
@Service
public class WebClientUpstreamClient implements UpstreamClient {

  private final WebClient webClient;
  private final UpstreamConfig upstreamConfig;

  public WebClientUpstreamClient(WebClient webClient, UpstreamConfig upstreamConfig) {
    this.webClient = webClient;
    this.upstreamConfig = upstreamConfig;
  }

  @Override
  public UpstreamSession authenticate() {
    String cookie = upstreamConfig.getCookie();
    if (cookie == null || cookie.isBlank()) {
      throw new AuthExpiredException(
          "No session cookie configured.\n"
              + "Please set HARVEST_COOKIE or harvest.upstream.cookie in application.properties");
    }

    GatewaySessionResponse response = get(uri("/session"), GatewaySessionResponse.class);
    if (response == null || !response.isAuthenticated()) {
      throw new AuthExpiredException("Upstream did not accept the session cookie (not authenticated)");
    }

    log.info("Authenticated upstream session as @{}", response.getScreenName());
    return new GatewaySession();
  }

  private URI uri(String path) {
    return UriComponentsBuilder.fromUriString(upstreamConfig.getBaseUrl())
        .path(path)
        .encode()
        .build()
        .toUri();
  }

  private <T> T get(URI uri, Class<T> responseType) {
    log.debug("Calling upstream: {}", uri);
    long startTime = System.currentTimeMillis();

    T response =
        webClient
            .get()
            .uri(uri)
            .header(HttpHeaders.COOKIE, upstreamConfig.getCookie())
            .retrieve()
            .bodyToMono(responseType)
            .block();

    log.debug("Upstream responded in {}ms", System.currentTimeMillis() - startTime);
    return response;
  }

  class GatewaySession implements UpstreamSession {

    private boolean closed = false;

    @Override
    public UpstreamPage search(String query, String cursor) {
      ensureOpen();
      URI uri =
          UriComponentsBuilder.fromUriString(upstreamConfig.getBaseUrl())
              .path("/search")
              .queryParam("q", query)
              .queryParamIfPresent("cursor", Optional.ofNullable(cursor))
              .encode()
              .build()
              .toUri();

      GatewayPageResponse response = get(uri, GatewayPageResponse.class);
      if (response == null) {
        throw new RecordNotFoundException("Empty response for search page " + cursor);
      }
      return new GatewayPage(this, query, cursor, response);
    }

    @Override
    public JsonNode fetchById(String tweetId) {
      ensureOpen();
      try {
        JsonNode payload = get(uri("/tweets/" + tweetId), JsonNode.class);
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
          throw new RecordNotFoundException("Tweet " + tweetId + " not found");
        }
        return payload;
      } catch (WebClientResponseException.NotFound e) {
        throw new RecordNotFoundException("Tweet " + tweetId + " not found", e);
      }
    }

    @Override
    public void close() {
      closed = true;
      log.debug("Upstream session closed");
    }

    private void ensureOpen() {
      if (closed) {
        throw new HarvestException("Upstream session already closed");
      }
    }
  }

  static class GatewayPage implements UpstreamPage {

    private final GatewaySession session;
    private final String query;
    private final String cursor;
    private final GatewayPageResponse response;

    GatewayPage(GatewaySession session, String query, String cursor, GatewayPageResponse response) {
      this.session = session;
      this.query = query;
      this.cursor = cursor;
      this.response = response;
    }

    @Override
    public List<JsonNode> records() {
      return response.getRecords() == null ? List.of() : response.getRecords();
    }

    @Override
    public Optional<UpstreamPage> next() {
      return nextCursor().map(next -> session.search(query, next));
    }

    @Override
    public Optional<String> nextCursor() {
      String nextCursor = response.getNextCursor();
      if (nextCursor == null || nextCursor.isBlank() || nextCursor.equals(cursor)) {
        return Optional.empty();
      }
      return Optional.of(nextCursor);
    }

    @Override
    public Optional<String> cursor() {
      return Optional.ofNullable(cursor);
    }
  }
}
