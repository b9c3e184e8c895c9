package com.example.slotnotifier.source;

import com.example.slotnotifier.domain.model.PlayerPreference;

import java.util.List;
import java.util.Optional;

/**
 * Where player preferences are read from. Every call returns current data.
 */
public interface PreferenceSource {

    List<PlayerPreference> findAll();

    Optional<PlayerPreference> findByIdentity(String identity);
}
