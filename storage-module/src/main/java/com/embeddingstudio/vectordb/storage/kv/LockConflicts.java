package com.embeddingstudio.vectordb.storage.kv;

import org.rocksdb.RocksDBException;
import org.rocksdb.Status;

final class LockConflicts {

    private LockConflicts() {
    }

    /**
     * Whether the failure means another transaction holds the row lock.
     */
    static boolean isLockConflict(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return false;
        }
        Status.Code code = status.getCode();
        return code == Status.Code.TimedOut || code == Status.Code.Busy || code == Status.Code.TryAgain;
    }
}
