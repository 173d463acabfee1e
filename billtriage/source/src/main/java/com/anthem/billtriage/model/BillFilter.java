package com.anthem.billtriage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-held filter criteria. Null fields are not applied; supplied fields are AND-ed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillFilter {

    /** Matches when any failure reason's kind token starts with this value; {@code Unknown} also matches bills without reasons. */
    private String kind;

    /** Exact provider display name ("Unknown Provider" for bills without one). */
    private String provider;

    private AgeBucket ageBucket;

    /** Case-insensitive substring of the filename. */
    private String searchText;

    public static BillFilter none() {
        return new BillFilter();
    }
}
