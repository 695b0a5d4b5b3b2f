package com.fileprovider.provider;

/**
 * Static provider metadata.
 *
 * @param version provider version
 * @param type provider type identifier
 */
public record ProviderInfo(String version, String type) {
}
