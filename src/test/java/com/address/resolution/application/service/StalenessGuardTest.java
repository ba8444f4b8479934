package com.address.resolution.application.service;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class StalenessGuardTest {

    private final StalenessGuard guard = new StalenessGuard();

    @Test
    void testIssue_SameSiteAndFlow_IncrementsSequence() {
        StalenessGuard.Ticket first = guard.issue("event-form", StalenessGuard.Flow.COORDINATES);
        StalenessGuard.Ticket second = guard.issue("event-form", StalenessGuard.Flow.COORDINATES);

        assertThat(second.getSequence()).isEqualTo(first.getSequence() + 1);
        assertThat(guard.isCurrent(first)).isFalse();
        assertThat(guard.isCurrent(second)).isTrue();
    }

    @Test
    void testIssue_DifferentSitesAndFlows_AreIndependent() {
        StalenessGuard.Ticket form = guard.issue("event-form", StalenessGuard.Flow.COORDINATES);
        guard.issue("location-picker", StalenessGuard.Flow.COORDINATES);
        guard.issue("event-form", StalenessGuard.Flow.SELECTION);

        assertThat(guard.isCurrent(form)).isTrue();
    }

    @Test
    void testIssue_BlankSite_SharesDefaultKey() {
        StalenessGuard.Ticket unnamed = guard.issue(null, StalenessGuard.Flow.QUERY);
        guard.issue("default", StalenessGuard.Flow.QUERY);

        assertThat(unnamed.getKey()).isEqualTo("default:QUERY");
        assertThat(guard.isCurrent(unnamed)).isFalse();
    }

    @Test
    void testGuard_StaleTicket_CompletesEmpty() {
        StalenessGuard.Ticket older = guard.issue("event-form", StalenessGuard.Flow.QUERY);
        StalenessGuard.Ticket newer = guard.issue("event-form", StalenessGuard.Flow.QUERY);

        assertThat(guard.guard(older, Mono.just("old")).blockOptional()).isEmpty();
        assertThat(guard.guard(newer, Mono.just("new")).block()).isEqualTo("new");
    }
}
