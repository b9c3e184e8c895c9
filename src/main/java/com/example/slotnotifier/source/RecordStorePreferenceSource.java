package com.example.slotnotifier.source;

import com.example.slotnotifier.client.RecordStoreClient;
import com.example.slotnotifier.domain.model.PlayerPreference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Player preferences read from the players sheet of the record store
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordStorePreferenceSource implements PreferenceSource {

    private final RecordStoreClient recordStoreClient;
    private final PlayerRecordMapper playerRecordMapper;
    private final IdentityNormalizer identityNormalizer;

    @Override
    public List<PlayerPreference> findAll() {
        var players = recordStoreClient.fetchPlayerRows().stream()
                .map(playerRecordMapper::toPreference)
                .toList();
        log.debug("Loaded {} player records", players.size());
        return players;
    }

    @Override
    public Optional<PlayerPreference> findByIdentity(String identity) {
        var normalized = identityNormalizer.normalize(identity);
        return findAll().stream()
                .filter(player -> Objects.equals(player.getIdentity(), normalized))
                .findFirst();
    }
}
