package com.example.slotnotifier.source;

import com.example.slotnotifier.domain.model.Slot;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Maps a row of a venue's availability sheet to a {@link Slot}
 */
@Component
public class SlotRecordMapper {

    static final String BUSINESS = "Business";
    static final String SPORT = "Sport";
    static final String LOCALITY = "Locality";
    static final String STATUS = "Status";
    static final String DATE = "Date";
    static final String TIMING = "Timing";
    static final String PRICE = "Price";
    static final String BOOKING = "Booking";

    public Slot toSlot(Map<String, Object> row) {
        return Slot.builder()
                .businessId(PlayerRecordMapper.text(row.get(BUSINESS)))
                .sport(PlayerRecordMapper.text(row.get(SPORT)))
                .locality(PlayerRecordMapper.text(row.get(LOCALITY)))
                .status(PlayerRecordMapper.text(row.get(STATUS)))
                .date(PlayerRecordMapper.text(row.get(DATE)))
                .timeRange(PlayerRecordMapper.text(row.get(TIMING)))
                .price(price(row.get(PRICE)))
                .bookingReference(PlayerRecordMapper.text(row.get(BOOKING)))
                .build();
    }

    /**
     * Whether the row has the columns matching needs
     */
    public boolean isComplete(Map<String, Object> row) {
        return PlayerRecordMapper.text(row.get(SPORT)) != null
                && PlayerRecordMapper.text(row.get(LOCALITY)) != null
                && PlayerRecordMapper.text(row.get(STATUS)) != null;
    }

    private static String price(Object cell) {
        if (cell instanceof Number number) {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        return PlayerRecordMapper.text(cell);
    }
}
