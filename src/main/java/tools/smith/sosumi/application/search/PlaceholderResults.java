package tools.smith.sosumi.application.search;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import tools.smith.sosumi.domain.search.SearchResult;

/**
 * Generic link results used only when a caller explicitly allows placeholders.
 *
 * @since 1.2.0
 */
public final class PlaceholderResults {
  static final String DOCS_SEARCH = "https://developer.apple.com/search/?q=";
  static final String VIDEOS_SEARCH = "https://developer.apple.com/videos/?q=";

  private PlaceholderResults() {}

  /**
   * Builds the two placeholder results for a query.
   *
   * @param query raw query text
   * @return documentation search and session search links
   */
  public static List<SearchResult> forQuery(String query) {
    String trimmed = query == null ? "" : query.trim();
    String encoded = URLEncoder.encode(trimmed, StandardCharsets.UTF_8).replace("+", "%20");
    return List.of(
        new SearchResult(
            "placeholder-docs",
            "Apple Developer Documentation",
            0,
            0.0,
            "Search Apple's official documentation for: " + trimmed,
            List.of(),
            "",
            DOCS_SEARCH + encoded),
        new SearchResult(
            "placeholder-videos",
            "WWDC Session Search",
            0,
            0.0,
            "Find WWDC sessions related to: " + trimmed,
            List.of(),
            "",
            VIDEOS_SEARCH + encoded));
  }

  /**
   * Indicates whether a result came from {@link #forQuery(String)}.
   *
   * @param result result to test
   * @return {@code true} for placeholder results
   */
  public static boolean isPlaceholder(SearchResult result) {
    return result.id().startsWith("placeholder-");
  }
}
