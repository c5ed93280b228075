package com.flamingo.ai.notionrag.store;

/** Handle for an upload whose indexing may still be in progress. */
public record UploadHandle(String storeId, String artifactId) {}
