package com.example.slotnotifier.source;

import com.example.slotnotifier.domain.model.Slot;

import java.util.List;

/**
 * Where court slots are read from. Every call returns a fresh snapshot.
 */
public interface AvailabilitySource {

    List<Slot> fetchSnapshot();
}
