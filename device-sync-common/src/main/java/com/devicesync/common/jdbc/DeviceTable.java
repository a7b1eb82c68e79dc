package com.devicesync.common.jdbc;

import com.devicesync.common.model.DeviceRecord;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Layout of the {@code device_item} table kept by both services, with the row
 * binding and mapping they share.
 */
public final class DeviceTable {

    public static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS device_item (
             device_item_id  UUID PRIMARY KEY
            ,device_type     VARCHAR(255) NOT NULL
            ,name            VARCHAR(255) NOT NULL
            ,model           VARCHAR(255) NOT NULL
            ,device_address  VARCHAR(255) NOT NULL
            ,serial_number   VARCHAR(255) NOT NULL
            ,status          VARCHAR(50) NOT NULL
            ,user_id         UUID
            ,home_id         UUID
        )
        """;

    public static final String COLUMNS = """
        device_item_id, device_type, name, model, device_address, serial_number, status, user_id, home_id""";

    public static final String SELECT_BY_ID = "SELECT " + COLUMNS + " FROM device_item WHERE device_item_id = ?";

    public static final String DELETE_BY_ID = "DELETE FROM device_item WHERE device_item_id = ?";

    private DeviceTable() {}

    public static void createIfMissing(DataSource dataSource) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
        } catch (SQLException e) {
            throw new DeviceStoreException("Failed to init device_item schema", e);
        }
    }

    /** Binds all columns, in {@link #COLUMNS} order, starting at parameter 1. */
    public static void bind(PreparedStatement stmt, DeviceRecord device) throws SQLException {
        stmt.setObject(1, device.id());
        stmt.setString(2, device.deviceType());
        stmt.setString(3, device.name());
        stmt.setString(4, device.model());
        stmt.setString(5, device.deviceAddress());
        stmt.setString(6, device.serialNumber());
        stmt.setString(7, device.status());
        stmt.setObject(8, device.userId());
        stmt.setObject(9, device.homeId());
    }

    public static DeviceRecord map(ResultSet rs) throws SQLException {
        return new DeviceRecord(
            rs.getObject("device_item_id", UUID.class),
            rs.getString("device_type"),
            rs.getString("name"),
            rs.getString("model"),
            rs.getString("device_address"),
            rs.getString("serial_number"),
            rs.getString("status"),
            rs.getObject("user_id", UUID.class),
            rs.getObject("home_id", UUID.class));
    }
}
