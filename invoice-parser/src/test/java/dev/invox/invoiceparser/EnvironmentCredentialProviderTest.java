package dev.invox.invoiceparser;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentCredentialProviderTest {

    @Test
    void prefersGeminiApiKey() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("GEMINI_API_KEY", " gemini-key ")
            .withProperty("AI_STUDIO_API_KEY", "studio-key");

        assertThat(new EnvironmentCredentialProvider(environment).getApiKey()).isEqualTo("gemini-key");
    }

    @Test
    void fallsBackToAiStudioKey() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("GEMINI_API_KEY", "   ")
            .withProperty("AI_STUDIO_API_KEY", "studio-key");

        assertThat(new EnvironmentCredentialProvider(environment).getApiKey()).isEqualTo("studio-key");
    }

    @Test
    void returnsNullWithoutKey() {
        assertThat(new EnvironmentCredentialProvider(new MockEnvironment()).getApiKey()).isNull();
    }

    @Test
    void readsKeyAddedAfterStartup() {
        MockEnvironment environment = new MockEnvironment();
        EnvironmentCredentialProvider provider = new EnvironmentCredentialProvider(environment);
        assertThat(provider.getApiKey()).isNull();

        environment.setProperty("GEMINI_API_KEY", "late-key");

        assertThat(provider.getApiKey()).isEqualTo("late-key");
    }
}
