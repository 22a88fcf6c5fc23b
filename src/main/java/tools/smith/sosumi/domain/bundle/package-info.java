/**
 * Value types describing a WWDC bundle: session records, archive metadata, and content protection.
 */
package tools.smith.sosumi.domain.bundle;
