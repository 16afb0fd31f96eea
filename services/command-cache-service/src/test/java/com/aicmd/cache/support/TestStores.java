package com.aicmd.cache.support;

import com.aicmd.cache.store.CommandStore;
import com.aicmd.cache.store.StoreLocationResolver;
import com.aicmd.cache.store.StoreProperties;
import java.nio.file.Path;

public final class TestStores {
    private TestStores() {
    }

    public static StoreProperties properties(Path directory) {
        StoreProperties properties = new StoreProperties();
        properties.setDirectory(directory.toString());
        properties.setBackoffBaseMs(1);
        properties.setBackoffMaxMs(5);
        return properties;
    }

    public static CommandStore open(Path directory) {
        StoreProperties properties = properties(directory);
        CommandStore store = new CommandStore(properties, new StoreLocationResolver(properties));
        store.initialize();
        return store;
    }

    public static CommandStore disabled() {
        StoreProperties properties = new StoreProperties();
        properties.setEnabled(false);
        return new CommandStore(properties, new StoreLocationResolver(properties));
    }
}
