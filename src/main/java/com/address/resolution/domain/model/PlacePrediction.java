package com.address.resolution.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Autocomplete suggestion shown to the user before a place is resolved.
 * The description is kept because the selection flow falls back to it.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PlacePrediction {
    private final String placeId;
    private final String description;
    private final String mainText;
    private final String secondaryText;

    public PlacePrediction(String placeId, String description, String mainText, String secondaryText) {
        if (placeId == null || placeId.isBlank()) {
            throw new IllegalArgumentException("Prediction place id must not be blank");
        }
        this.placeId = placeId;
        this.description = description == null ? "" : description;
        this.mainText = mainText == null ? this.description : mainText;
        this.secondaryText = secondaryText == null ? "" : secondaryText;
    }
}
