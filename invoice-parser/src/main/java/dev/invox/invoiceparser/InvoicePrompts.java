package dev.invox.invoiceparser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

/**
 * Instructions and response schema sent with every extraction request.
 */
public class InvoicePrompts {

    public static final String SCHEMA_RESOURCE = "invoice-schema.json";

    static final String SYSTEM_INSTRUCTION = String.join("\n",
        "You are an invoice parser. Read the provided document (PDF or image) and extract ONLY the requested fields.",
        "Rules:",
        "1) Your output must strictly conform to the response JSON schema provided with the request.",
        "2) Extract all fields defined in the schema when they are clearly present. If a field is missing or cannot be"
            + " confidently determined, use null (or an empty array for items).",
        "3) Do NOT invent, guess, or normalize values beyond what is printed. Never hallucinate GSTINs, addresses,"
            + " dates, or totals.",
        "4) Strip currency symbols and thousand separators from numeric amounts; return numeric fields as plain"
            + " numbers when present.",
        "5) For GST fields use only values that are explicitly present or clearly implied on the invoice. Do NOT"
            + " compute or back-calculate missing taxes or totals.",
        "6) For totals (subtotal, tax total, grand total): if printed, read them exactly; otherwise use null.",
        "7) Prefer ISO dates (YYYY-MM-DD) when the date can be parsed reliably; otherwise return it as printed.",
        "8) Preserve original spelling and case for all text fields.",
        "9) Keep units in the dedicated unit field and out of quantity, rate and amount.",
        "10) Fill voucher number, reference number and reference date only when they are explicitly labeled.",
        "11) The items array must always be present, even when empty.",
        "12) Return ONLY a single valid JSON object, with no extra text before or after.");

    static final String USER_PROMPT = """
        Given a single invoice document (PDF or image), extract a JSON object that strictly matches the response schema.

        Top-level keys include "seller name", "seller address", "seller gstin", "buyer name", "buyer address",
        "buyer gstin", "invoce number", "voucher number", "reference number", "date", "reference date",
        "voucher type", "place of supply", "subtotal", "tax total", "grand total" and "items".

        Each element of "items" has the keys "description", "name", "HSN/SAC", "quantity", "unit", "rate",
        "amount", "cgst", "sgst", "cgst_rate" and "sgst_rate".

        Do not invent values, use null when fields are missing, and return ONLY the JSON object.
        """.strip();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String systemInstruction;
    private final String userPrompt;
    private final Map<String, Object> responseSchema;

    public InvoicePrompts(String systemInstruction, String userPrompt, Map<String, Object> responseSchema) {
        this.systemInstruction = systemInstruction;
        this.userPrompt = userPrompt;
        this.responseSchema = responseSchema;
    }

    public static InvoicePrompts load(ObjectMapper objectMapper) {
        Resource resource = new ClassPathResource(SCHEMA_RESOURCE);
        try (InputStream inputStream = resource.getInputStream()) {
            Map<String, Object> schema = objectMapper.readValue(inputStream, MAP_TYPE);
            return new InvoicePrompts(SYSTEM_INSTRUCTION, USER_PROMPT, schema);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to load invoice response schema from " + SCHEMA_RESOURCE, ex);
        }
    }

    public String systemInstruction() {
        return systemInstruction;
    }

    public String userPrompt() {
        return userPrompt;
    }

    public Map<String, Object> responseSchema() {
        return responseSchema;
    }
}
