package com.evintel.charging.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw registry entry as delivered by the station collector (OpenChargeMap shaped).
 * Kept separate from {@link Station} to isolate collector coupling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawStation {

    private String id;
    private String name;
    private Double latitude;
    private Double longitude;
    private String operator;
    private String network;
    private String status;
}
