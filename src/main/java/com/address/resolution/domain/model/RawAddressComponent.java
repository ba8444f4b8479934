package com.address.resolution.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One address component as returned by the geocoding provider, e.g.
 * {@code {types: [locality, political], long_name: "Springfield", short_name: "Springfield"}}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class RawAddressComponent {
    private final Set<String> tags;
    private final String longValue;
    private final String shortValue;

    public RawAddressComponent(Collection<String> tags, String longValue, String shortValue) {
        this.tags = tags == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.longValue = longValue == null ? "" : longValue;
        this.shortValue = shortValue == null ? this.longValue : shortValue;
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
