package com.anthem.billtriage.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class AgeBucketTest {

    @Test
    void forAge_boundaries() {
        assertThat(AgeBucket.forAge(0)).isEqualTo(AgeBucket.DAYS_0_30);
        assertThat(AgeBucket.forAge(30)).isEqualTo(AgeBucket.DAYS_0_30);
        assertThat(AgeBucket.forAge(31)).isEqualTo(AgeBucket.DAYS_31_60);
        assertThat(AgeBucket.forAge(60)).isEqualTo(AgeBucket.DAYS_31_60);
        assertThat(AgeBucket.forAge(61)).isEqualTo(AgeBucket.DAYS_61_PLUS);
    }

    @Test
    void forAge_futureDatedServiceIsNewest() {
        assertThat(AgeBucket.forAge(-5)).isEqualTo(AgeBucket.DAYS_0_30);
    }

    @Test
    void matches_undefinedAgeNeverMatches() {
        for (AgeBucket bucket : AgeBucket.values()) {
            assertThat(bucket.matches(Optional.empty())).isFalse();
        }
        assertThat(AgeBucket.forAge(Optional.empty())).isEmpty();
    }

    @Test
    void fromValue_acceptsLabelsAndNames() {
        assertThat(AgeBucket.fromValue("31–60")).contains(AgeBucket.DAYS_31_60);
        assertThat(AgeBucket.fromValue("31-60")).contains(AgeBucket.DAYS_31_60);
        assertThat(AgeBucket.fromValue("61+")).contains(AgeBucket.DAYS_61_PLUS);
        assertThat(AgeBucket.fromValue("days_0_30")).contains(AgeBucket.DAYS_0_30);
        assertThat(AgeBucket.fromValue("90+")).isEmpty();
        assertThat(AgeBucket.fromValue(" ")).isEmpty();
    }
}
