package dev.invox.invoiceparser;

import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Reads the API key from {@code GEMINI_API_KEY}, falling back to {@code AI_STUDIO_API_KEY}. The key is looked up on
 * every call so that the service starts without one and picks it up once configured.
 */
public class EnvironmentCredentialProvider implements CredentialProvider {

    static final String GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String AI_STUDIO_API_KEY = "AI_STUDIO_API_KEY";

    private final Environment environment;

    public EnvironmentCredentialProvider(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String getApiKey() {
        String apiKey = environment.getProperty(GEMINI_API_KEY);
        if (StringUtils.hasText(apiKey)) {
            return apiKey.trim();
        }
        apiKey = environment.getProperty(AI_STUDIO_API_KEY);
        return StringUtils.hasText(apiKey) ? apiKey.trim() : null;
    }
}
