package dev.invox.invoiceparser.googleai;

import org.springframework.util.StringUtils;

/**
 * Generation settings applied to every {@code generateContent} call. Unset sampling values are left out of the
 * request so Gemini applies its own defaults.
 */
public record GeminiGenerationOptions(
    String model,
    Double temperature,
    Double topP,
    Integer topK,
    Integer maxOutputTokens
) {

    public static final GeminiGenerationOptions NONE = new GeminiGenerationOptions(null, null, null, null, null);

    /**
     * @return these options targeting {@code requestedModel}, or unchanged when it is blank
     */
    public GeminiGenerationOptions forModel(String requestedModel) {
        if (!StringUtils.hasText(requestedModel)) {
            return this;
        }
        return new GeminiGenerationOptions(requestedModel.trim(), temperature, topP, topK, maxOutputTokens);
    }
}
