package com.rde.ingestion.client;

/**
 * Fetches one page of items from a content source.
 *
 * <p>Implementations never throw for expected failures: rate limiting, rejected credentials and
 * exhausted transient retries are reported through {@link FetchResult#outcome()}. Only the
 * network call is a side effect; credentials may be renewed transparently between calls.
 */
public interface SourceClient {

    FetchResult fetch(String source, ListingType listing, int limit);
}
