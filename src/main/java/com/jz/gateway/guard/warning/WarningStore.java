package com.jz.gateway.guard.warning;

import java.util.Optional;

public interface WarningStore {

    Optional<WarningRecord> findOne(WarningKey key);

    void upsert(WarningRecord record);
}
