package org.starledger.timeline.store.h2;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.UUID;

/**
 * Creates timeline stores backed by private in-memory H2 databases.
 */
public final class InMemoryStores {

    private InMemoryStores() {}

    public static Config config(String name) {
        return ConfigFactory.parseString("jdbcUrl = \"jdbc:h2:mem:" + name + "-" + UUID.randomUUID()
                + ";DB_CLOSE_DELAY=-1\"\nmaxPoolSize = 4\nminIdle = 1");
    }

    public static H2TimelineStore create(String name) {
        return new H2TimelineStore(config(name));
    }
}
