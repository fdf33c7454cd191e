package com.quantinfo.collector.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptor of an instrument as known to a provider, used both for search results and
 * for profile enrichment.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InstrumentProfile {

    private String symbol;
    private String name;
    private String exchange;
    private String sector;
    private String industry;
    private String currency;
    private Double marketCap;

    // set by search when the symbol is already stored locally
    private boolean existsInUniverse;
}
