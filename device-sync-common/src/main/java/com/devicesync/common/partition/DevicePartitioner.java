package com.devicesync.common.partition;

import org.apache.kafka.common.utils.Utils;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Routes every event of one device to one partition of the {@code device} topic.
 *
 * Hash contract, identical in any client that has to agree on placement:
 * murmur2 (Kafka's default partitioner hash, seed {@code 0x9747b28c}) over the
 * 16 bytes of the UUID, most significant long first, big-endian; the sign bit is
 * cleared and the result taken modulo the partition count.
 */
public final class DevicePartitioner {

    /** Partition count of the {@code device} topic in the reference deployment. */
    public static final int DEFAULT_PARTITION_COUNT = 3;

    private DevicePartitioner() {}

    public static int partition(UUID deviceId, int partitionCount) {
        if (deviceId == null) {
            throw new IllegalArgumentException("deviceId must not be null");
        }
        if (partitionCount <= 0) {
            throw new IllegalArgumentException("partitionCount must be > 0, got: " + partitionCount);
        }
        return Utils.toPositive(Utils.murmur2(toBytes(deviceId))) % partitionCount;
    }

    static byte[] toBytes(UUID id) {
        return ByteBuffer.allocate(16)
            .putLong(id.getMostSignificantBits())
            .putLong(id.getLeastSignificantBits())
            .array();
    }
}
