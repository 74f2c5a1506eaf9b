package com.mailattribution.state;

import com.mailattribution.model.AttributionSnapshot;
import com.mailattribution.model.DataPartnerAnalytics;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * Holds the raw tracking data, the attribution snapshot built from it and the cached partner
 * analytics. Writers swap whole immutable values under the write lock; readers take only the
 * read lock.
 */
@Component
public class TrackingDataStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private TrackingData data = TrackingData.empty();
    private AttributionSnapshot snapshot = AttributionSnapshot.empty();
    private DataPartnerAnalytics partnerAnalytics;

    public void publish(TrackingData newData, AttributionSnapshot newSnapshot) {
        lock.writeLock().lock();
        try {
            this.data = newData;
            this.snapshot = newSnapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void publishPartnerAnalytics(DataPartnerAnalytics analytics) {
        lock.writeLock().lock();
        try {
            this.partnerAnalytics = analytics;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TrackingData getData() {
        lock.readLock().lock();
        try {
            return data;
        } finally {
            lock.readLock().unlock();
        }
    }

    public AttributionSnapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<DataPartnerAnalytics> getPartnerAnalytics() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(partnerAnalytics);
        } finally {
            lock.readLock().unlock();
        }
    }
}
