/**
 * Markdown and JSON renderers for search results, year listings, and single sessions.
 */
package tools.smith.sosumi.infrastructure.render;
