package com.jz.gateway.support;

import com.jz.gateway.guard.warning.WarningEvent;
import com.jz.gateway.guard.warning.WarningKey;
import com.jz.gateway.guard.warning.WarningRecord;
import com.jz.gateway.guard.warning.WarningStore;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWarningStore implements WarningStore {

    private final Map<String, WarningRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<WarningRecord> findOne(WarningKey key) {
        return Optional.ofNullable(records.get(key.id())).map(InMemoryWarningStore::copy);
    }

    @Override
    public void upsert(WarningRecord record) {
        records.put(record.key().id(), copy(record));
    }

    /** 直接看存储里的状态，不经过清扫 */
    public WarningRecord raw(WarningKey key) {
        WarningRecord r = records.get(key.id());
        return r == null ? null : copy(r);
    }

    private static WarningRecord copy(WarningRecord r) {
        ArrayList<WarningEvent> events = new ArrayList<>();
        r.getEvents().forEach(e -> events.add(new WarningEvent(e.getReason(), e.getTs(), e.getIssuerId())));
        return WarningRecord.builder()
                .participantId(r.getParticipantId())
                .chatId(r.getChatId())
                .events(events)
                .warningCount(r.getWarningCount())
                .lastWarningDate(r.getLastWarningDate())
                .banned(r.isBanned())
                .banDate(r.getBanDate())
                .banReason(r.getBanReason())
                .createdAt(r.getCreatedAt())
                .build();
    }
}
