/**
 * JSON archive codec built on Jackson streaming.
 * <p><strong>Role:</strong> Encodes archives with a fixed field order and decodes them with strict field checks.</p>
 * <p><strong>Security:</strong> Parse errors never echo record content.</p>
 */
package tools.smith.sosumi.infrastructure.codec;
