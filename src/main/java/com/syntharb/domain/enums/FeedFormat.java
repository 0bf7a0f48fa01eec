package com.syntharb.domain.enums;

/**
 * Raw input encodings accepted from the upstream feed.
 */
public enum FeedFormat {
    JSON,
    CSV,
    BINARY
}
