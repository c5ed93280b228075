package com.flamingo.ai.notionrag.store;

/** A registered database whose store exists, with its document count. */
public record StoreSummary(String label, String storeId, long documentCount) {}
