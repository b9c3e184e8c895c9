package com.example.slotnotifier.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of rebuilding jobs from a preference snapshot
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileResult {

    private int totalRecords;
    private int scheduled;
    private int skipped;
    private int failed;

    /**
     * Jobs removed because their player is no longer in the snapshot
     */
    private int removed;

    /**
     * One line per skipped or failed record, with the reason
     */
    @Builder.Default
    private List<String> problems = new ArrayList<>();
}
