package com.warden.security;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.cert.CertificateException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TrustListCertificateValidator")
class TrustListCertificateValidatorTest {

    @Test
    @DisplayName("accepts a certificate issued by a trusted CA")
    void chainsToTrustedIssuer() {
        var validator = new TrustListCertificateValidator(List.of(CertificateFixtures.ca()));

        assertThatCode(() -> validator.validate(CertificateFixtures.user())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("accepts a self-signed certificate listed directly")
    void directlyTrusted() {
        var validator = new TrustListCertificateValidator(List.of(CertificateFixtures.rogue()));

        assertThatCode(() -> validator.validate(CertificateFixtures.rogue())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("rejects a certificate from an unknown issuer")
    void unknownIssuer() {
        var validator = new TrustListCertificateValidator(List.of(CertificateFixtures.ca()));

        assertThatThrownBy(() -> validator.validate(CertificateFixtures.rogue()))
                .isInstanceOf(CertificateException.class)
                .hasMessageContaining("trusted issuer");
    }

    @Test
    @DisplayName("empty trust list rejects everything")
    void emptyTrustList() {
        var validator = new TrustListCertificateValidator(List.of());

        assertThatThrownBy(() -> validator.validate(CertificateFixtures.user()))
                .isInstanceOf(CertificateException.class)
                .hasMessage("trust list is empty");
    }
}
