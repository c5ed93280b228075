package com.flamingo.ai.notionrag.notion;

import com.flamingo.ai.notionrag.exception.InvalidIdentifierException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses page and database references.
 *
 * <p>Accepted forms, for both pages and databases:
 *
 * <ul>
 *   <li>a bare 32-character hex id
 *   <li>a dashed UUID
 *   <li>a URL whose last path segment ends with either form, e.g. {@code
 *       https://www.notion.so/Team-Notes-286c479a8fc21c807d134a19e9ae7065?v=...}
 * </ul>
 *
 * <p>Ids are returned lower-case without dashes so they compare equal regardless of source.
 */
public final class NotionIds {

  private static final Pattern BARE_ID = Pattern.compile("^[0-9a-f]{32}$");
  private static final Pattern TRAILING_ID = Pattern.compile("([0-9a-f]{32})$");

  private NotionIds() {}

  public static String parse(String urlOrId) {
    if (urlOrId == null || urlOrId.isBlank()) {
      throw new InvalidIdentifierException(String.valueOf(urlOrId));
    }
    String input = urlOrId.trim();

    if (input.contains("/")) {
      String path = stripQueryAndFragment(input);
      while (path.endsWith("/")) {
        path = path.substring(0, path.length() - 1);
      }
      String lastSegment = path.substring(path.lastIndexOf('/') + 1);
      Matcher matcher = TRAILING_ID.matcher(compact(lastSegment));
      if (matcher.find()) {
        return matcher.group(1);
      }
      throw new InvalidIdentifierException(urlOrId);
    }

    String candidate = compact(stripQueryAndFragment(input));
    if (BARE_ID.matcher(candidate).matches()) {
      return candidate;
    }
    throw new InvalidIdentifierException(urlOrId);
  }

  /** Normalizes an id already returned by the API (dashed or not). */
  public static String normalize(String apiId) {
    return parse(apiId);
  }

  private static String stripQueryAndFragment(String input) {
    int cut = input.length();
    int query = input.indexOf('?');
    if (query >= 0) {
      cut = query;
    }
    int fragment = input.indexOf('#');
    if (fragment >= 0 && fragment < cut) {
      cut = fragment;
    }
    return input.substring(0, cut);
  }

  private static String compact(String value) {
    return value.replace("-", "").toLowerCase(Locale.ROOT);
  }
}
