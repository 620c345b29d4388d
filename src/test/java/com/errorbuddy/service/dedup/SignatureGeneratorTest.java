package com.errorbuddy.service.dedup;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.support.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SignatureGeneratorTest {

    private ReporterProperties properties;
    private SignatureGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new ReporterProperties();
        generator = new SignatureGenerator(properties);
    }

    @Test
    void shouldProduceEightHexCharacters() {
        String signature = generator.signatureOf(Reports.valid().build());

        assertThat(signature).matches("[0-9a-f]{8}");
    }

    @Test
    void shouldBeStableForSameIdentity() {
        ErrorReport first = Reports.valid().build();
        ErrorReport second = Reports.valid()
                .stackTrace("different trace")
                .extra(Map.of("request", "/other"))
                .critical(true)
                .build();

        assertThat(generator.signatureOf(first)).isEqualTo(generator.signatureOf(second));
    }

    @Test
    void shouldChangeWithEachIdentityField() {
        String base = generator.signatureOf(Reports.valid().build());

        assertThat(generator.signatureOf(Reports.valid().message("Other message").build())).isNotEqualTo(base);
        assertThat(generator.signatureOf(Reports.valid().file("b.php").build())).isNotEqualTo(base);
        assertThat(generator.signatureOf(Reports.valid().line(11).build())).isNotEqualTo(base);
        assertThat(generator.signatureOf(Reports.valid().code("404").build())).isNotEqualTo(base);
    }

    @Test
    void shouldIncludeAppVersionWhenConfigured() {
        String unversioned = generator.signatureOf(Reports.valid().build());

        properties.setAppVersion("2.4.1");
        String versioned = generator.signatureOf(Reports.valid().build());
        properties.setAppVersion("2.4.2");
        String nextRelease = generator.signatureOf(Reports.valid().build());

        assertThat(versioned).isNotEqualTo(unversioned);
        assertThat(nextRelease).isNotEqualTo(versioned);
    }

    @Test
    void shouldIgnoreAppVersionWhenTagDisabled() {
        String unversioned = generator.signatureOf(Reports.valid().build());

        properties.setAppVersion("2.4.1");
        properties.getDedup().setIncludeVersionTag(false);

        assertThat(generator.signatureOf(Reports.valid().build())).isEqualTo(unversioned);
    }
}
