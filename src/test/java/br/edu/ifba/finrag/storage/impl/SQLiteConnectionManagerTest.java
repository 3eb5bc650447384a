package br.edu.ifba.finrag.storage.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SQLiteConnectionManagerTest {

    @TempDir
    Path tempDir;

    @Test
    void inMemoryDatabasesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SQLiteConnectionManager(":memory:"));
        assertThrows(IllegalArgumentException.class, () -> new SQLiteConnectionManager(" "));
    }

    @Test
    void readConnectionsAreReused() {
        SQLiteConnectionManager manager = new SQLiteConnectionManager(
                tempDir.resolve("pool.db").toString(), Duration.ofSeconds(5), 2);
        try {
            Connection first = manager.getReadConnection();
            manager.releaseReadConnection(first);
            Connection second = manager.getReadConnection();
            assertEquals(first, second);
            manager.releaseReadConnection(second);
        } finally {
            manager.close();
        }
    }

    @Test
    void writeConnectionIsSharedAcrossCalls() throws Exception {
        SQLiteConnectionManager manager = new SQLiteConnectionManager(tempDir.resolve("write.db").toString());
        try {
            Connection first = manager.getWriteConnection();
            manager.releaseWriteConnection(first);
            Connection second = manager.getWriteConnection();
            try {
                assertFalse(second.isClosed());
                assertEquals(first, second);
            } finally {
                manager.releaseWriteConnection(second);
            }
        } finally {
            manager.close();
        }
    }

    @Test
    void closedManagerRefusesConnections() {
        SQLiteConnectionManager manager = new SQLiteConnectionManager(tempDir.resolve("closed.db").toString());
        manager.close();
        assertThrows(IllegalStateException.class, manager::createConnection);
    }
}
