package tools.smith.sosumi.domain.search;

/**
 * Timestamped transcript context that mentions the query.
 *
 * @param approximateTime timestamp token as it appears in the transcript (for example {@code 12:45})
 * @param text whitespace-collapsed context, truncated for display
 * @since 1.2.0
 */
public record TimeSegment(String approximateTime, String text) {}
