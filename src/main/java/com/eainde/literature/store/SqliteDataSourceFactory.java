package com.eainde.literature.store;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * SQLite data source shared by all document workers.
 *
 * <p>WAL journaling lets readers proceed while one writer holds the lock; writers
 * wait at most {@code busyTimeout} for the lock. Transactions begin IMMEDIATE so a
 * writer takes the lock up front instead of failing on a read-to-write upgrade.</p>
 */
public final class SqliteDataSourceFactory {

    private SqliteDataSourceFactory() {
    }

    public static DataSource create(String databasePath, Duration busyTimeout) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout((int) busyTimeout.toMillis());
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.enforceForeignKeys(true);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databasePath);
        return dataSource;
    }
}
