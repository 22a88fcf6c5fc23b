/**
 * End-to-end use cases: search, session lookup, year listing, statistics, and bundle build.
 */
package tools.smith.sosumi.application.pipeline;
