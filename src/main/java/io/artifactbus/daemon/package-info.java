/**
 * Ingestion daemon: inbox scan, parallel validation, serialized commit and crash recovery.
 */
package io.artifactbus.daemon;
