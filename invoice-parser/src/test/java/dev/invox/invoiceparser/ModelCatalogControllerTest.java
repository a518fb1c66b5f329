package dev.invox.invoiceparser;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.invox.invoiceparser.catalog.ModelCatalog;
import dev.invox.invoiceparser.catalog.ModelCatalogRepository;
import dev.invox.invoiceparser.catalog.ModelRateLimit;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ModelCatalogControllerTest {

    @Mock
    private ModelCatalogRepository modelCatalogRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ModelCatalogController(modelCatalogRepository)).build();
    }

    @Test
    void returnsCurrentCatalog() throws Exception {
        when(modelCatalogRepository.current()).thenReturn(ModelCatalog.defaults());

        mockMvc.perform(get("/api/models"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.defaultModel").value("gemini-2.5-flash"))
            .andExpect(jsonPath("$.models.length()").value(5))
            .andExpect(jsonPath("$.rateLimits['gemini-2.5-pro'].rpd").value(100))
            .andExpect(jsonPath("$.effectiveFallbackOrder").doesNotExist());
    }

    @Test
    void listsEntriesWithFallbackPositions() throws Exception {
        ModelCatalog catalog = new ModelCatalog("b", List.of("a", "b"), List.of("b"),
            Map.of("b", new ModelRateLimit(2, 100, 1)));
        when(modelCatalogRepository.current()).thenReturn(catalog);

        mockMvc.perform(get("/api/models/entries"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].model").value("a"))
            .andExpect(jsonPath("$[0].fallbackPosition").value(-1))
            .andExpect(jsonPath("$[0].rateLimit.rpm").value(0))
            .andExpect(jsonPath("$[1].model").value("b"))
            .andExpect(jsonPath("$[1].defaultModel").value(true))
            .andExpect(jsonPath("$[1].rateLimit.rpd").value(100));
    }

    @Test
    void refreshReturnsReloadedCatalog() throws Exception {
        when(modelCatalogRepository.refresh()).thenReturn(ModelCatalog.defaults());

        mockMvc.perform(post("/api/models/refresh"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.defaultModel").value("gemini-2.5-flash"));

        verify(modelCatalogRepository).refresh();
    }
}
