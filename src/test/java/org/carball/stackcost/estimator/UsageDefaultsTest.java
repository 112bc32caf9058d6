package org.carball.stackcost.estimator;

import org.carball.stackcost.model.service.ServiceFamily;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.carball.stackcost.estimator.UsageKeys.*;

public class UsageDefaultsTest {

    @Test
    void shouldNotAllowStandardDefaultsToBeModified() {
        // Given
        UsageDefaults defaults = UsageDefaults.standard();

        // When/Then
        assertThatThrownBy(() -> defaults.getGenericDefaults().put(AVG_MONTHLY_REQUESTS, 1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> defaults.getFamilyDefaults().get(ServiceFamily.LAMBDA).put(AVG_MEMORY_SIZE, 4096))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> defaults.getFamilyDefaults().remove(ServiceFamily.EC2))
                .isInstanceOf(UnsupportedOperationException.class);

        assertThat(UsageDefaults.standard().forFamily(ServiceFamily.LAMBDA).get(AVG_MEMORY_SIZE)).isEqualTo(128);
    }

    @Test
    void shouldDeriveCopiesWithoutTouchingTheOriginal() {
        // Given
        UsageDefaults defaults = UsageDefaults.standard();

        // When
        UsageDefaults withFreeTier = defaults.toBuilder().genericDefault(APPLY_FREE_TIER, true).build();

        // Then
        assertThat(withFreeTier.getGenericDefaults()).containsEntry(APPLY_FREE_TIER, true);
        assertThat(defaults.getGenericDefaults()).containsEntry(APPLY_FREE_TIER, false);
        assertThat(withFreeTier.getFamilyDefaults()).isEqualTo(defaults.getFamilyDefaults());
    }
}
