package com.assetmetrics.history.upstream;

import com.assetmetrics.history.domain.Page;

/**
 * Fetches one page of metric samples from the upstream monitoring API.
 * Abstracts the transport so the windowed reader can be exercised with a fake upstream.
 */
public interface UpstreamClient {

    /**
     * Fetches the page at the given URL.
     *
     * @param url Fully built request URL, or the continuation URL of a previous page
     * @return The decoded page; its {@code next} is empty when no more pages exist
     * @throws com.assetmetrics.history.exception.UpstreamTransportException if the upstream cannot be reached
     * @throws com.assetmetrics.history.exception.UpstreamErrorException if the upstream answers with status >= 400
     * @throws com.assetmetrics.history.exception.MalformedResponseException if the payload cannot be decoded
     */
    Page fetch(String url);
}
