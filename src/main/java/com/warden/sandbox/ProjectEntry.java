package com.warden.sandbox;

/**
 * One entry of a project directory listing.
 *
 * @param path path relative to the project root, with forward slashes
 */
public record ProjectEntry(String name, String path, boolean directory, long size) {
}
