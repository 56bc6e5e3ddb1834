package com.analyticssync.domain.model;

/**
 * Where a returned payload came from.
 */
public enum DataSource {

    /** Fresh cache entry, no upstream call. */
    CACHE,

    /** Fetched from upstream by this call (or a concurrent identical call it joined). */
    NETWORK,

    /** Upstream failed; a previously cached, possibly expired, payload was served instead. */
    STALE_FALLBACK
}
