package dev.invox.invoiceparser;

import dev.invox.invoiceparser.catalog.ModelCatalog;
import dev.invox.invoiceparser.catalog.ModelCatalogEntry;
import dev.invox.invoiceparser.catalog.ModelCatalogRepository;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/models", produces = MediaType.APPLICATION_JSON_VALUE)
public class ModelCatalogController {

    private final ModelCatalogRepository modelCatalogRepository;

    public ModelCatalogController(ModelCatalogRepository modelCatalogRepository) {
        this.modelCatalogRepository = modelCatalogRepository;
    }

    @GetMapping
    public ModelCatalog catalog() {
        return modelCatalogRepository.current();
    }

    @GetMapping("/entries")
    public List<ModelCatalogEntry> entries() {
        return modelCatalogRepository.current().entries();
    }

    @PostMapping("/refresh")
    public ModelCatalog refresh() {
        return modelCatalogRepository.refresh();
    }
}
