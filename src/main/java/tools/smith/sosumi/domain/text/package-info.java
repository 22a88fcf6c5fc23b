/** Title obfuscation and canonical session links. */
package tools.smith.sosumi.domain.text;
