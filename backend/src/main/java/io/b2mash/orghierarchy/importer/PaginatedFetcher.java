package io.b2mash.orghierarchy.importer;

import java.net.URI;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a paginated endpoint and yields its records in page order. Pages are fetched lazily, one
 * at a time, as the returned sequence is consumed. Every call to {@link #fetch(URI)} starts a new,
 * independent walk.
 */
public class PaginatedFetcher {

  private static final Logger log = LoggerFactory.getLogger(PaginatedFetcher.class);

  private final SourceClient sourceClient;
  private final ImportConfiguration configuration;

  public PaginatedFetcher(SourceClient sourceClient, ImportConfiguration configuration) {
    this.sourceClient = sourceClient;
    this.configuration = configuration;
  }

  public Stream<Object> fetch(URI url) {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterate(url), Spliterator.ORDERED), false);
  }

  public Iterator<Object> iterate(URI url) {
    return new PageIterator(url);
  }

  private List<?> records(URI pageUrl, Object page) {
    Object records = page;
    if (configuration.resultsKey() != null) {
      if (!(page instanceof Map<?, ?> map)) {
        throw new DataImportException("Expected a JSON object from " + pageUrl);
      }
      records = map.get(configuration.resultsKey());
      if (records == null) {
        return List.of();
      }
    }
    if (!(records instanceof List<?> list)) {
      throw new DataImportException("Expected a list of records from " + pageUrl);
    }
    return list;
  }

  private URI nextPage(URI pageUrl, Object page) {
    if (configuration.nextKey() == null || !(page instanceof Map<?, ?> map)) {
      return null;
    }
    Object container = map;
    if (configuration.hasMeta()) {
      container = map.get(configuration.metaKey());
      if (!(container instanceof Map<?, ?>)) {
        return null;
      }
    }
    Object next = ((Map<?, ?>) container).get(configuration.nextKey());
    if (next == null || next.toString().isEmpty()) {
      return null;
    }
    try {
      return pageUrl.resolve(next.toString());
    } catch (IllegalArgumentException e) {
      throw new FetchException("Invalid next page link " + next + " from " + pageUrl, e);
    }
  }

  private final class PageIterator implements Iterator<Object> {

    private final Set<URI> visited = new HashSet<>();
    private URI nextPage;
    private Iterator<?> current = Collections.emptyIterator();

    private PageIterator(URI firstPage) {
      this.nextPage = firstPage;
    }

    @Override
    public boolean hasNext() {
      while (!current.hasNext() && nextPage != null) {
        loadPage();
      }
      return current.hasNext();
    }

    @Override
    public Object next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return current.next();
    }

    private void loadPage() {
      URI pageUrl = nextPage;
      if (!visited.add(pageUrl)) {
        throw new FetchException("Pagination loop detected at " + pageUrl);
      }
      log.info("Fetching organization data from {}", pageUrl);
      Object page = sourceClient.getJson(pageUrl);
      List<?> records = records(pageUrl, page);
      log.info("Fetched {} records from {}", records.size(), pageUrl);
      current = records.iterator();
      nextPage = nextPage(pageUrl, page);
    }
  }
}
