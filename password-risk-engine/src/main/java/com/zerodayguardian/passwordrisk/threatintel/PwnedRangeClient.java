package com.zerodayguardian.passwordrisk.threatintel;

import reactor.core.publisher.Mono;

/**
 * Transport for the k-anonymity range endpoint.
 *
 * <p>
 * Implementations receive only the 5-character hash prefix and return the
 * raw {@code SUFFIX:COUNT} response body. Errors are signalled through the
 * returned {@link Mono}.
 * </p>
 *
 * @author Naveed Gung
 */
@FunctionalInterface
public interface PwnedRangeClient {

    /**
     * Fetch all hash suffixes sharing the given prefix.
     *
     * @param prefix 5 uppercase hex characters
     * @return the response body
     */
    Mono<String> fetchRange(String prefix);
}
