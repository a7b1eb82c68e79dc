package com.devicesync.publisher.kafka;

/**
 * Broker acknowledgment of a published device event.
 */
public record PublishReceipt(String topic, int partition, long offset) {}
