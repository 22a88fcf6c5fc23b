/** Search queries, results, and transcript time segments. */
package tools.smith.sosumi.domain.search;
