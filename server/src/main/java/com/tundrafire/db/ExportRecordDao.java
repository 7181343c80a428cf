package com.tundrafire.db;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ExportRecordDao {

    private final String dbPath;

    public ExportRecordDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public void upsert(int year, String exportName, int featureCount, int pixelCount, String location)
            throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO export_record " +
                "(export_name, analysis_year, feature_count, pixel_count, location, created_ts) " +
                "VALUES (?, ?, ?, ?, ?, ?) " +
                "ON CONFLICT(export_name) DO UPDATE SET " +
                "analysis_year = excluded.analysis_year, feature_count = excluded.feature_count, " +
                "pixel_count = excluded.pixel_count, location = excluded.location, created_ts = excluded.created_ts";

        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, exportName);
            ps.setInt(2, year);
            ps.setInt(3, featureCount);
            ps.setInt(4, pixelCount);
            ps.setString(5, location);
            ps.setLong(6, now);
            ps.executeUpdate();
        }
    }

    public Optional<ExportRecord> findByName(String exportName) throws SQLException {
        String sql = "SELECT * FROM export_record WHERE export_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, exportName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(read(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<ExportRecord> listByYear(int year) throws SQLException {
        String sql = "SELECT * FROM export_record WHERE analysis_year = ? ORDER BY export_name";
        List<ExportRecord> records = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, year);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(read(rs));
                }
            }
        }
        return records;
    }

    private ExportRecord read(ResultSet rs) throws SQLException {
        return new ExportRecord(
                rs.getLong("id"),
                rs.getString("export_name"),
                rs.getInt("analysis_year"),
                rs.getInt("feature_count"),
                rs.getInt("pixel_count"),
                rs.getString("location"),
                rs.getLong("created_ts"));
    }
}
