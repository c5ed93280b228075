package com.flamingo.ai.notionrag.registry;

/**
 * A registered Notion database.
 *
 * @param label short name used to address the database and its store
 * @param url database URL (or bare id) as registered
 * @param databaseId normalized 32-character id parsed from {@code url}
 */
public record DatabaseEntry(String label, String url, String databaseId) {}
