package com.example.slotnotifier.source;

import com.example.slotnotifier.client.RecordStoreClient;
import com.example.slotnotifier.domain.model.Slot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Slot snapshot read from the availability sheets of the record store.
 * Rows without sport, locality or status are left out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordStoreAvailabilitySource implements AvailabilitySource {

    private final RecordStoreClient recordStoreClient;
    private final SlotRecordMapper slotRecordMapper;

    @Override
    public List<Slot> fetchSnapshot() {
        var rows = recordStoreClient.fetchSlotRows();
        var slots = rows.stream()
                .filter(slotRecordMapper::isComplete)
                .map(slotRecordMapper::toSlot)
                .toList();
        if (slots.size() < rows.size()) {
            log.warn("Ignored {} incomplete slot rows", rows.size() - slots.size());
        }
        log.debug("Fetched snapshot of {} slots", slots.size());
        return slots;
    }
}
