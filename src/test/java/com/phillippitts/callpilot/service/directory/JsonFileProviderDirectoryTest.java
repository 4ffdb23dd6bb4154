package com.phillippitts.callpilot.service.directory;

import com.phillippitts.callpilot.domain.Provider;
import com.phillippitts.callpilot.exception.ProviderDirectoryException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileProviderDirectoryTest {

    private static JsonFileProviderDirectory directory(String location) {
        return new JsonFileProviderDirectory(new DefaultResourceLoader(), location);
    }

    @Test
    void loadsProvidersWithFieldFallbacks() {
        List<Provider> providers = directory("classpath:directory/valid-providers.json").loadProviders();

        assertThat(providers).extracting(Provider::id).containsExactly("1", "b-2", "3");

        Provider alpha = providers.get(0);
        assertThat(alpha.distanceMiles()).isEqualTo(2.1);
        assertThat(alpha.coordinates()).isEqualTo(new Provider.Coordinates(37.7793, -122.4193));

        Provider beta = providers.get(1);
        assertThat(beta.phone()).isEqualTo(Provider.USER_TEST_PHONE);
        assertThat(beta.distanceMiles()).isEqualTo(0.5);
        assertThat(beta.rating()).isEqualTo(4.2);
        assertThat(beta.availability()).isEqualTo(0.95);
        assertThat(beta.coordinates().latitude()).isEqualTo(37.7749);

        Provider gamma = providers.get(2);
        assertThat(gamma.distanceMiles()).isEqualTo(1.0);
        assertThat(gamma.rating()).isNull();
        assertThat(gamma.phone()).isNull();
        assertThat(gamma.coordinates()).isNull();
    }

    @Test
    void bundledDirectoryLoads() {
        List<Provider> providers = directory("classpath:providers.json").loadProviders();

        assertThat(providers).hasSize(6);
        assertThat(providers).allSatisfy(p -> assertThat(p.rating()).isNotNull());
    }

    @Test
    void missingFileIsReported() {
        assertThatThrownBy(() -> directory("classpath:directory/nope.json").loadProviders())
                .isInstanceOf(ProviderDirectoryException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedJsonIsReported() {
        assertThatThrownBy(() -> directory("classpath:directory/malformed.json").loadProviders())
                .isInstanceOf(ProviderDirectoryException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void entryWithoutNameIsRejected() {
        assertThatThrownBy(() -> directory("classpath:directory/missing-name.json").loadProviders())
                .isInstanceOf(ProviderDirectoryException.class)
                .hasMessageContaining("has no name");
    }

    @Test
    void nonNumericRankingFieldIsRejected() {
        assertThatThrownBy(() -> directory("classpath:directory/bad-number.json").loadProviders())
                .isInstanceOf(ProviderDirectoryException.class)
                .hasMessageContaining("distance_miles");
    }
}
