package com.devicesync.publisher.device;

import com.devicesync.common.jdbc.DeviceStoreException;
import com.devicesync.common.jdbc.DeviceTable;
import com.devicesync.common.model.DeviceRecord;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * Device items owned by the device-management service. This is the source of
 * truth the telemetry side converges on.
 */
public class DeviceItemRepository {

    private static final String INSERT_SQL =
        "INSERT INTO device_item (" + DeviceTable.COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;

    public DeviceItemRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void initSchema() {
        DeviceTable.createIfMissing(dataSource);
    }

    public void insert(DeviceRecord device) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(INSERT_SQL)) {
            DeviceTable.bind(stmt, device);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DeviceStoreException("Failed to insert device " + device.id(), e);
        }
    }

    public Optional<DeviceRecord> find(UUID id) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(DeviceTable.SELECT_BY_ID)) {
            stmt.setObject(1, id);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(DeviceTable.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DeviceStoreException("Failed to load device " + id, e);
        }
    }

    /** @return true if a row was removed */
    public boolean delete(UUID id) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(DeviceTable.DELETE_BY_ID)) {
            stmt.setObject(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new DeviceStoreException("Failed to delete device " + id, e);
        }
    }
}
