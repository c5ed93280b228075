package com.flamingo.ai.notionrag.sync;

/**
 * Decides whether a page must be re-indexed.
 *
 * <p>Timestamps are compared as opaque strings. A formatting difference between the source and
 * the stored value counts as a change.
 */
public final class ChangeDetector {

  private ChangeDetector() {}

  /**
   * Classifies a page.
   *
   * @param currentEdited the page's current {@code last_edited_time}
   * @param storedEdited the {@code last_edited} metadata of the stored artifact, empty when there
   *     is no artifact
   * @param force re-index even when the timestamps match
   */
  public static ChangeStatus classify(String currentEdited, String storedEdited, boolean force) {
    if (storedEdited == null || storedEdited.isEmpty()) {
      return ChangeStatus.NEW;
    }
    if (!force && storedEdited.equals(currentEdited)) {
      return ChangeStatus.UNCHANGED;
    }
    return ChangeStatus.CHANGED;
  }
}
