package tools.smith.sosumi.infrastructure.render;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import tools.smith.sosumi.domain.search.SearchResult;
import tools.smith.sosumi.domain.search.TimeSegment;

/**
 * JSON rendering with a fixed field order so output diffs cleanly between runs.
 *
 * @since 1.2.0
 */
public final class JsonResultRenderer implements ResultRenderer {
  private final JsonFactory jsonFactory = new JsonFactory();

  @Override
  public String renderResults(String query, List<SearchResult> results, RenderStyle style, int limit) {
    List<SearchResult> shown = results.isEmpty() ? List.of() : ResultRenderer.ranked(results, limit);
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("query", query);
      gen.writeStringField("mode", style.label());
      gen.writeNumberField("totalMatches", results.size());
      gen.writeNumberField("resultCount", shown.size());
      writeResults(gen, shown, style);
      gen.writeEndObject();
    });
  }

  @Override
  public String renderListing(String heading, List<SearchResult> results, RenderStyle style, int limit) {
    List<SearchResult> shown = results.isEmpty() ? List.of() : ResultRenderer.ranked(results, limit);
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("listing", heading);
      gen.writeStringField("mode", style.label());
      gen.writeNumberField("totalMatches", results.size());
      gen.writeNumberField("resultCount", shown.size());
      writeResults(gen, shown, style);
      gen.writeEndObject();
    });
  }

  @Override
  public String renderSession(SearchResult session, RenderStyle style) {
    return write(gen -> {
      gen.writeStartObject();
      gen.writeStringField("id", session.id());
      gen.writeStringField("title", session.title());
      gen.writeNumberField("year", session.year());
      gen.writeStringField("webUrl", session.webUrl());
      gen.writeStringField("mode", style.label());
      if (style == RenderStyle.AGENT) {
        gen.writeArrayFieldStart("paragraphs");
        for (String paragraph : TranscriptParagraphs.split(session.transcript())) {
          gen.writeString(paragraph);
        }
        gen.writeEndArray();
      } else {
        gen.writeStringField("excerpt", session.excerpt());
      }
      gen.writeEndObject();
    });
  }

  private static void writeResults(JsonGenerator gen, List<SearchResult> shown, RenderStyle style)
      throws IOException {
    gen.writeArrayFieldStart("results");
    for (SearchResult result : shown) {
      gen.writeStartObject();
      gen.writeStringField("id", result.id());
      gen.writeStringField("title", result.title());
      gen.writeNumberField("year", result.year());
      gen.writeNumberField("relevanceScore", result.relevanceScore());
      gen.writeStringField("webUrl", result.webUrl());
      if (style != RenderStyle.COMPACT) {
        gen.writeStringField("excerpt", result.excerpt());
      }
      if (style == RenderStyle.AGENT) {
        gen.writeArrayFieldStart("timeSegments");
        for (TimeSegment segment : result.timeSegments()) {
          gen.writeStartObject();
          gen.writeStringField("time", segment.approximateTime());
          gen.writeStringField("text", segment.text());
          gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("paragraphs");
        for (String paragraph : TranscriptParagraphs.split(result.transcript())) {
          gen.writeString(paragraph);
        }
        gen.writeEndArray();
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private String write(JsonBody body) {
    StringWriter writer = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(writer)) {
      gen.useDefaultPrettyPrinter();
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return writer.toString();
  }

  @FunctionalInterface
  private interface JsonBody {
    void write(JsonGenerator gen) throws IOException;
  }
}
