package com.document.resource.core.model;

/**
 * Kind of remote resource whose text is held in the content cache.
 * Informational only: resolution never branches on the kind.
 */
public enum ResourceKind {
    DOCUMENT,
    SPREADSHEET,
    FILE
}
