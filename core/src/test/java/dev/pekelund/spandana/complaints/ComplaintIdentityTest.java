package dev.pekelund.spandana.complaints;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComplaintIdentityTest {

    @Test
    void anonymousIdentityIsNotAuthenticated() {
        assertThat(ComplaintIdentity.anonymous().isAuthenticated()).isFalse();
        assertThat(ComplaintIdentity.anonymous().username()).isEqualTo(ComplaintIdentity.PLACEHOLDER);
        assertThat(new ComplaintIdentity(" asha ", "").isAuthenticated()).isFalse();
    }

    @Test
    void fieldsAreTrimmedAndNullsBecomeEmpty() {
        ComplaintIdentity identity = new ComplaintIdentity(" asha ", "hash");

        assertThat(identity.username()).isEqualTo("asha");
        assertThat(identity.isAuthenticated()).isTrue();
        assertThat(new ComplaintIdentity(null, null).passwordHash()).isEmpty();
    }
}
