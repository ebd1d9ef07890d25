package org.Aayush.tempo.zone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Process-wide read-only zone store.
 * <p>
 * The default store is built on first use from {@link ZoneDatabaseConfig#fromSystemProperties()}
 * and never changes afterwards. A failed build is not cached: the {@link ZoneRecordException}
 * reaches the caller and the next call builds again, so fixing {@code tempo.zone.file} recovers
 * without a restart.
 * </p>
 */
public final class ZoneDatabase {
    private static final Logger LOGGER = LoggerFactory.getLogger(ZoneDatabase.class);
    private static final DefaultStore DEFAULT_STORE =
            new DefaultStore(() -> load(ZoneDatabaseConfig.fromSystemProperties()));

    private ZoneDatabase() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the process-wide store, building it on first successful call.
     *
     * @throws ZoneRecordException when the configured zone file is unreadable or corrupt.
     */
    public static ZoneStore get() {
        return DEFAULT_STORE.get();
    }

    /**
     * Builds a new store from {@code config}.
     *
     * @throws ZoneRecordException when the configured zone file is unreadable or corrupt.
     */
    public static ZoneStore load(ZoneDatabaseConfig config) {
        Objects.requireNonNull(config, "config");
        InMemoryZoneStore.Builder builder = InMemoryZoneStore.builder();
        if (config.isIncludeJavaZoneRules()) {
            builder.addAll(new JavaZoneRulesProvider(config.getReferenceInstant()).records());
        }
        if (config.isIncludeBuiltIn()) {
            builder.addAll(new BuiltInZoneRecordProvider().records());
        }
        if (config.getZoneFile() != null) {
            builder.addAll(FileZoneStore.open(config.getZoneFile()));
        }
        InMemoryZoneStore store = builder.build();
        LOGGER.info(
                "Zone database ready with {} zones (javaRules={}, builtIn={}, file={})",
                store.size(),
                config.isIncludeJavaZoneRules(),
                config.isIncludeBuiltIn(),
                config.getZoneFile()
        );
        return store;
    }

    /**
     * Lazily built store; published once, retried while loading fails.
     */
    static final class DefaultStore {
        private final Supplier<ZoneStore> loader;
        private volatile ZoneStore store;

        DefaultStore(Supplier<ZoneStore> loader) {
            this.loader = Objects.requireNonNull(loader, "loader");
        }

        ZoneStore get() {
            ZoneStore current = store;
            if (current != null) {
                return current;
            }
            synchronized (this) {
                if (store == null) {
                    try {
                        store = loader.get();
                    } catch (ZoneRecordException e) {
                        LOGGER.warn("Default zone database failed to load, next lookup retries: {}", e.getMessage());
                        throw e;
                    }
                }
                return store;
            }
        }
    }
}
