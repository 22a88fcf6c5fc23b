/**
 * Bundle discovery across the explicit path, the home directory, the working directory, and the install directory.
 */
package tools.smith.sosumi.infrastructure.locate;
