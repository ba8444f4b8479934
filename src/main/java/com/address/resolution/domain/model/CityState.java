package com.address.resolution.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public class CityState {
    private final String city;
    private final String state;

    public CityState(String city, String state) {
        this.city = city == null ? "" : city;
        this.state = state == null ? "" : state;
    }
}
