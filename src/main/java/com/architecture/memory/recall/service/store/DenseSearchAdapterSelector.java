package com.architecture.memory.recall.service.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the dense search request shape once, from configuration and the server version.
 */
@Slf4j
public final class DenseSearchAdapterSelector {

    public enum QueryApiMode {
        AUTO, QUERY, SEARCH;

        public static QueryApiMode from(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private static final Pattern VERSION = Pattern.compile("^v?(\\d+)\\.(\\d+)");

    private DenseSearchAdapterSelector() {
    }

    public static DenseSearchAdapter select(QueryApiMode mode, QdrantRestClient client) {
        if (mode == QueryApiMode.SEARCH) {
            log.info("[Qdrant REST] Dense search uses points/search (configured)");
            return new LegacySearchPointsAdapter();
        }

        String version = readVersion(client);
        boolean queryApiAvailable = supportsQueryApi(version);

        if (mode == QueryApiMode.QUERY) {
            if (version != null && !queryApiAvailable) {
                log.warn("[Qdrant REST] points/query configured but server {} predates it; using points/search",
                        version);
                return new LegacySearchPointsAdapter();
            }
            log.info("[Qdrant REST] Dense search uses points/query (configured, server {})", version);
            return new QueryPointsSearchAdapter();
        }

        if (queryApiAvailable) {
            log.info("[Qdrant REST] Dense search uses points/query (server {})", version);
            return new QueryPointsSearchAdapter();
        }
        log.warn("[Qdrant REST] Dense search falls back to points/search (server version: {})", version);
        return new LegacySearchPointsAdapter();
    }

    /**
     * True for 1.10 and later; false for older or unparseable versions.
     */
    static boolean supportsQueryApi(String version) {
        if (version == null) {
            return false;
        }
        Matcher matcher = VERSION.matcher(version.trim());
        if (!matcher.find()) {
            return false;
        }
        int major = Integer.parseInt(matcher.group(1));
        int minor = Integer.parseInt(matcher.group(2));
        return major > 1 || (major == 1 && minor >= 10);
    }

    private static String readVersion(QdrantRestClient client) {
        try {
            return client.getServerVersion();
        } catch (IndexStoreException e) {
            log.warn("[Qdrant REST] Could not read server version: {}", e.getMessage());
            return null;
        }
    }
}
