package com.flamingo.ai.notionrag.image;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the vision model's reply.
 *
 * <p>Expected shape:
 *
 * <pre>
 * TYPE: terminal | diagram | other
 * DESCRIPTION: one or two sentences
 * CODE:
 * ```
 * verbatim output
 * ```
 * </pre>
 *
 * <p>Sections may span several lines and end at the next marker. When neither a description nor
 * code can be found, the whole reply becomes the description.
 */
public final class ImageReplyParser {

  private static final String TYPE_MARKER = "TYPE:";
  private static final String DESCRIPTION_MARKER = "DESCRIPTION:";
  private static final String CODE_MARKER = "CODE:";
  private static final String FENCE = "```";
  private static final int MAX_LANGUAGE_TAG_LENGTH = 20;

  private ImageReplyParser() {}

  /** Parsed sections of a reply. */
  public record ParsedReply(ImageClassification classification, String description, String code) {}

  private enum Section {
    NONE,
    DESCRIPTION,
    CODE
  }

  public static ParsedReply parse(String raw) {
    String reply = raw == null ? "" : raw;
    ImageClassification classification = ImageClassification.OTHER;
    List<String> descriptionLines = new ArrayList<>();
    List<String> codeLines = new ArrayList<>();
    Section section = Section.NONE;

    for (String line : reply.strip().split("\n", -1)) {
      String stripped = line.strip();
      String upper = stripped.toUpperCase(Locale.ROOT);
      if (upper.startsWith(TYPE_MARKER)) {
        classification =
            ImageClassification.fromReply(stripped.substring(TYPE_MARKER.length()).strip());
        section = Section.NONE;
      } else if (upper.startsWith(DESCRIPTION_MARKER)) {
        descriptionLines.add(stripped.substring(DESCRIPTION_MARKER.length()).strip());
        section = Section.DESCRIPTION;
      } else if (upper.startsWith(CODE_MARKER)) {
        String remainder = stripped.substring(CODE_MARKER.length()).strip();
        if (!remainder.isEmpty()) {
          codeLines.add(remainder);
        }
        section = Section.CODE;
      } else if (section == Section.DESCRIPTION) {
        descriptionLines.add(line.stripTrailing());
      } else if (section == Section.CODE) {
        codeLines.add(line.stripTrailing());
      }
    }

    String description = String.join("\n", descriptionLines).strip();
    String code = stripFence(String.join("\n", codeLines).strip());

    if (description.isEmpty() && code.isEmpty()) {
      description = reply.strip();
    }
    return new ParsedReply(classification, description, code);
  }

  /**
   * Removes one enclosing pair of fence markers and an optional language tag on the opening line.
   */
  static String stripFence(String code) {
    if (!code.startsWith(FENCE) || !code.endsWith(FENCE)) {
      return code;
    }
    String inner = code.substring(FENCE.length());
    if (inner.endsWith(FENCE)) {
      inner = inner.substring(0, inner.length() - FENCE.length());
    }
    int firstNewline = inner.indexOf('\n');
    if (firstNewline != -1) {
      String firstLine = inner.substring(0, firstNewline);
      String tag = firstLine.strip();
      if (!tag.isEmpty()
          && !firstLine.startsWith(" ")
          && tag.length() < MAX_LANGUAGE_TAG_LENGTH) {
        inner = inner.substring(firstNewline + 1);
      }
    }
    return inner.strip();
  }
}
