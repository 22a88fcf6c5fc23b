/** DEFLATE (zlib) block compression. */
package tools.smith.sosumi.infrastructure.compression;
