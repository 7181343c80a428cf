package com.tundrafire.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode = WAL;");

                stmt.execute("CREATE TABLE IF NOT EXISTS export_record (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "export_name TEXT NOT NULL UNIQUE, " +
                        "analysis_year INTEGER NOT NULL, " +
                        "feature_count INTEGER NOT NULL, " +
                        "pixel_count INTEGER NOT NULL, " +
                        "location TEXT, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_export_year " +
                        "ON export_record (analysis_year, export_name);");
            }
        }
    }
}
