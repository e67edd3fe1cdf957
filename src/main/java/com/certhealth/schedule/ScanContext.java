package com.certhealth.schedule;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 스윕(또는 즉시 점검) 단위의 취소 신호입니다.
 * cancel() 이 반환된 뒤에는 이 컨텍스트로 어떤 레코드도 저장되지 않습니다.
 */
final class ScanContext {

    final String name;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean cancelled;

    ScanContext(String name) {
        this.name = name;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        lock.writeLock().lock();
        try {
            cancelled = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 취소되지 않았으면 write 를 실행합니다. 서로 다른 도메인의 쓰기는 동시에 진행됩니다.
     *
     * @return 실행했으면 true
     */
    boolean recordIfActive(Runnable write) {
        lock.readLock().lock();
        try {
            if (cancelled) return false;
            write.run();
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }
}
