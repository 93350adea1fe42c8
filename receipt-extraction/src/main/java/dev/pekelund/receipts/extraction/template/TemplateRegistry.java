package dev.pekelund.receipts.extraction.template;

import dev.pekelund.receipts.extraction.extract.FieldExtractor;
import dev.pekelund.receipts.extraction.extract.GenericFieldExtractor;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of merchant templates in registration order, plus the anchor-free generic
 * template used as fallback. Built once at startup and shared by all requests.
 */
public class TemplateRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateRegistry.class);

    private final Map<String, ReceiptTemplate> templates;
    private final ReceiptTemplate generic;

    public TemplateRegistry(List<ReceiptTemplate> templates, FieldExtractor genericExtractor) {
        Objects.requireNonNull(templates, "templates");
        this.generic = new ReceiptTemplate(GenericFieldExtractor.TEMPLATE_ID, "Generic", List.of(),
            Objects.requireNonNull(genericExtractor, "genericExtractor"));

        Map<String, ReceiptTemplate> registrations = new LinkedHashMap<>();
        for (ReceiptTemplate template : templates) {
            String id = normalise(template.id());
            if (id.equals(generic.id())) {
                throw new TemplateDefinitionException("Template id '" + id + "' is reserved for the generic template");
            }
            if (template.anchors().isEmpty()) {
                throw new TemplateDefinitionException("Template '" + id + "' must declare at least one anchor");
            }
            if (registrations.putIfAbsent(id, template) != null) {
                throw new TemplateDefinitionException("Duplicate template id '" + id + "'");
            }
        }
        this.templates = Collections.unmodifiableMap(registrations);
        LOGGER.info("Initialised receipt template registry with templates: {}", this.templates.keySet());
    }

    /**
     * @return registered merchant templates in registration order, without the generic template
     */
    public Collection<ReceiptTemplate> templates() {
        return templates.values();
    }

    public ReceiptTemplate generic() {
        return generic;
    }

    public Optional<ReceiptTemplate> find(String templateId) {
        if (templateId == null) {
            return Optional.empty();
        }
        String normalised = normalise(templateId);
        if (normalised.equals(generic.id())) {
            return Optional.of(generic);
        }
        return Optional.ofNullable(templates.get(normalised));
    }

    public List<TemplateDescriptor> describe() {
        return templates.values().stream()
            .map(template -> new TemplateDescriptor(template.id(), template.displayName(), template.anchors().size()))
            .toList();
    }

    private static String normalise(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }

    public record TemplateDescriptor(String id, String displayName, int anchorCount) { }
}
