package io.artifactbus.bus;

public record DataStat(long sizeBytes, String sha256) {
}
