/**
 * Artifact bus source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.artifactbus.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.artifactbus.producer.ProducerClient} is the only API producers need.</li>
 *   <li>{@code io.artifactbus.daemon.BusDaemon} validates, commits and catalogs inbox jobs.</li>
 *   <li>{@code io.artifactbus.storage.Database} is the authority over the catalog schema.</li>
 * </ul>
 */
package io.artifactbus;
