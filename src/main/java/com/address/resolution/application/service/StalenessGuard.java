package com.address.resolution.application.service;

import com.address.resolution.application.port.in.ResolveAddressUseCase;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tags calls with monotonically increasing sequence numbers per call site and flow,
 * and drops completions that are no longer the latest issued.
 *
 * Provider reads are idempotent, so a superseded request is left to finish and its
 * result is discarded on arrival instead of being aborted.
 */
@Component
public class StalenessGuard {

    private static final Logger logger = LoggerFactory.getLogger(StalenessGuard.class);

    public enum Flow {
        SELECTION,
        COORDINATES,
        QUERY,
        PREDICTIONS
    }

    private final ConcurrentMap<String, AtomicLong> latestIssued = new ConcurrentHashMap<>();

    /**
     * Issue the next sequence number for a call site and flow.
     * Must be called when the request is made, not when its Mono is subscribed.
     */
    public Ticket issue(String callSite, Flow flow) {
        String key = buildKey(callSite, flow);
        long sequence = latestIssued.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        return new Ticket(key, sequence);
    }

    public boolean isCurrent(Ticket ticket) {
        AtomicLong latest = latestIssued.get(ticket.getKey());
        return latest != null && latest.get() == ticket.getSequence();
    }

    /**
     * Let the result through only if no newer call was issued for the same key in the meantime.
     */
    public <T> Mono<T> guard(Ticket ticket, Mono<T> result) {
        return result.filter(value -> {
            if (isCurrent(ticket)) {
                return true;
            }
            logger.debug("Dropping stale result for {} (sequence {})", ticket.getKey(), ticket.getSequence());
            return false;
        });
    }

    private String buildKey(String callSite, Flow flow) {
        String site = callSite == null || callSite.isBlank() ? ResolveAddressUseCase.DEFAULT_CALL_SITE : callSite;
        return site + ":" + flow.name();
    }

    /**
     * Sequence number handed out for one call.
     */
    @Getter
    @EqualsAndHashCode
    @ToString
    @AllArgsConstructor
    public static class Ticket {
        private final String key;
        private final long sequence;
    }
}
