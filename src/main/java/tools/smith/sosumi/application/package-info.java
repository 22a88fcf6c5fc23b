/**
 * Use cases and services of sosumi, independent of file formats and libraries.
 */
package tools.smith.sosumi.application;
