package io.routeweave.core.store;

import java.util.UUID;

/** Fresh, migrated in-memory H2 databases for store-backed tests. */
public final class TestDatabases {

    private TestDatabases() {}

    public static Database inMemory() {
        Database database =
                Database.open("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", 4);
        database.migrate();
        return database;
    }
}
