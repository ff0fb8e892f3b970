package io.b2mash.orghierarchy.importer;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Blocking GET + JSON access to import sources. Responses are parsed into plain Java values: maps,
 * lists, strings, numbers, booleans or null. There is no retry; any failure is a {@link
 * FetchException}.
 */
@Component
public class SourceClient {

  private static final Logger log = LoggerFactory.getLogger(SourceClient.class);

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public SourceClient(
      @Qualifier("importRestClient") RestClient restClient, ObjectMapper objectMapper) {
    this.restClient = restClient;
    this.objectMapper = objectMapper;
  }

  public Object getJson(URI uri) {
    log.debug("GET {}", uri);
    byte[] body;
    try {
      body = restClient.get().uri(uri).retrieve().body(byte[].class);
    } catch (RestClientException e) {
      throw new FetchException("Request to " + uri + " failed: " + e.getMessage(), e);
    }
    if (body == null || body.length == 0) {
      throw new FetchException("Empty response from " + uri);
    }
    try {
      return objectMapper.readValue(body, Object.class);
    } catch (JacksonException e) {
      throw new FetchException("Response from " + uri + " is not valid JSON", e);
    }
  }
}
