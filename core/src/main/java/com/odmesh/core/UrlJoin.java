package com.odmesh.core;

import java.net.URI;

/**
 * Hierarchical URL combination: the path is resolved against the base, an absolute path replaces it.
 */
final class UrlJoin {

    private UrlJoin() {
    }

    static String join(String base, String path) {
        if (base == null || base.isEmpty()) {
            return path == null ? "" : path;
        }
        if (path == null || path.isEmpty()) {
            return base;
        }
        try {
            URI relative = URI.create(path);
            if (relative.isAbsolute()) {
                return path;
            }
            URI root = URI.create(base);
            if (root.getRawAuthority() != null && (root.getRawPath() == null || root.getRawPath().isEmpty())) {
                root = URI.create(root.getScheme() + "://" + root.getRawAuthority() + "/");
            }
            return root.resolve(relative).toString();
        } catch (IllegalArgumentException e) {
            throw new EntityDefinitionException("Cannot join URL " + base + " with " + path, e);
        }
    }
}
