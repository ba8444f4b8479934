package com.address.resolution.domain.service;

import com.address.resolution.domain.model.GeocodeCandidate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Domain service picking one candidate out of a reverse geocode response.
 *
 * Selection Rule: start from the first candidate (providers rank by relevance) and take the
 * first one, in order, whose formatted address does not lead with a Plus Code and which has
 * at least {@value #MIN_COMPONENTS} components. If none qualifies the first candidate stays.
 */
@Service
public class CandidateSelector {

    /**
     * Below this a result is usually area-level (city, region, country) rather than a street.
     */
    public static final int MIN_COMPONENTS = 4;

    /**
     * @param candidates Non-empty provider candidates in provider order
     * @return Selected candidate
     * @throws IllegalArgumentException if the list is null or empty
     */
    public GeocodeCandidate select(List<GeocodeCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one candidate is required for selection");
        }

        for (GeocodeCandidate candidate : candidates) {
            if (isStreetLevel(candidate)) {
                return candidate;
            }
        }
        return candidates.get(0);
    }

    private boolean isStreetLevel(GeocodeCandidate candidate) {
        String leading = PlusCodes.leadingSegment(candidate.getFormattedAddress());
        return !PlusCodes.isPlusCode(leading) && candidate.getComponents().size() >= MIN_COMPONENTS;
    }
}
