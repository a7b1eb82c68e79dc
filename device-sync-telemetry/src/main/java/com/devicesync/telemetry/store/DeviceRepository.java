package com.devicesync.telemetry.store;

import com.devicesync.common.jdbc.DeviceStoreException;
import com.devicesync.common.jdbc.DeviceTable;
import com.devicesync.common.model.DeviceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

/**
 * Telemetry-side projection of devices. Both writes are idempotent, so a
 * redelivered event leaves the table as it was.
 */
public class DeviceRepository {

    private static final Logger log = LoggerFactory.getLogger(DeviceRepository.class);

    private static final String INSERT_IF_ABSENT_SQL = "INSERT INTO device_item (" + DeviceTable.COLUMNS + ")"
        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING";

    private static final int MAX_CONFLICT_ATTEMPTS = 5;

    // 40xxx: transaction rollback class (serialization failure, deadlock).
    // 90131: H2 reports an insert racing an uncommitted row with the same key this way.
    private static final String H2_CONCURRENT_UPDATE = "90131";

    private final DataSource dataSource;

    public DeviceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void initSchema() {
        DeviceTable.createIfMissing(dataSource);
        log.info("device_item schema ready");
    }

    /**
     * A write conflict with a concurrent insert of the same id is retried; the
     * retry then sees the committed row and inserts nothing.
     *
     * @return false if a row with the same id already existed
     */
    public boolean insertIfAbsent(DeviceRecord device) {
        for (int attempt = 1; ; attempt++) {
            try (var conn = dataSource.getConnection();
                 var stmt = conn.prepareStatement(INSERT_IF_ABSENT_SQL)) {
                DeviceTable.bind(stmt, device);
                return stmt.executeUpdate() > 0;
            } catch (SQLException e) {
                if (attempt < MAX_CONFLICT_ATTEMPTS && isWriteConflict(e)) {
                    log.debug("Write conflict inserting device {} (attempt {}), retrying", device.id(), attempt);
                    continue;
                }
                throw new DeviceStoreException("Failed to insert device " + device.id(), e);
            }
        }
    }

    /** @return false if there was no such row */
    public boolean deleteIfPresent(UUID id) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(DeviceTable.DELETE_BY_ID)) {
            stmt.setObject(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new DeviceStoreException("Failed to delete device " + id, e);
        }
    }

    static boolean isWriteConflict(SQLException e) {
        String state = e.getSQLState();
        return state != null && (state.startsWith("40") || H2_CONCURRENT_UPDATE.equals(state));
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
}
