package com.flamingo.ai.notionrag.sync;

/** Outcome of comparing a page against its stored artifact. */
public enum ChangeStatus {
  /** No artifact exists for the page. */
  NEW,
  /** The page was edited since it was stored, or re-indexing was forced. */
  CHANGED,
  /** The stored artifact reflects the current page. */
  UNCHANGED;

  public boolean needsIndexing() {
    return this != UNCHANGED;
  }
}
