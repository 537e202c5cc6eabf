/**
 * Runtime wiring package.
 *
 * <p>{@link io.artifactbus.runtime.ArtifactBusRuntime} builds the inbox, lock, catalog,
 * export engine and daemon from one configuration and exposes the operations used by the CLI.
 */
package io.artifactbus.runtime;
