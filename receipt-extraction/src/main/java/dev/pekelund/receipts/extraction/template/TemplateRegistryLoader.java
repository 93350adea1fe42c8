package dev.pekelund.receipts.extraction.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.extract.GenericFieldExtractor;
import dev.pekelund.receipts.extraction.extract.ReceiptAmounts;
import dev.pekelund.receipts.extraction.extract.TemplateDatePattern;
import dev.pekelund.receipts.extraction.extract.TemplateFieldExtractor;
import dev.pekelund.receipts.extraction.extract.TemplatePatterns;
import dev.pekelund.receipts.extraction.extract.TotalsField;
import java.io.IOException;
import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.springframework.core.io.Resource;
import org.springframework.util.StringUtils;

/**
 * Builds the {@link TemplateRegistry} from a JSON resource. Item patterns may use the
 * {@code {amount}} placeholder for the shared currency amount expression.
 */
public class TemplateRegistryLoader {

    static final String AMOUNT_PLACEHOLDER = "{amount}";

    private final ObjectMapper objectMapper;
    private final FieldConfidencePolicy confidencePolicy;

    public TemplateRegistryLoader(ObjectMapper objectMapper, FieldConfidencePolicy confidencePolicy) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.confidencePolicy = Objects.requireNonNull(confidencePolicy, "confidencePolicy");
    }

    public TemplateRegistry load(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        if (!resource.exists()) {
            throw new TemplateDefinitionException("Template resource " + resource.getDescription() + " does not exist");
        }
        TemplateFile file;
        try (InputStream inputStream = resource.getInputStream()) {
            file = objectMapper.readValue(inputStream, TemplateFile.class);
        } catch (IOException ex) {
            throw new TemplateDefinitionException(
                "Failed to read template resource " + resource.getDescription(), ex);
        }
        return build(file);
    }

    TemplateRegistry build(TemplateFile file) {
        List<ReceiptTemplate> templates = new ArrayList<>();
        if (file != null && file.templates() != null) {
            for (TemplateDefinition definition : file.templates()) {
                templates.add(toTemplate(definition));
            }
        }
        return new TemplateRegistry(templates, new GenericFieldExtractor(confidencePolicy));
    }

    private ReceiptTemplate toTemplate(TemplateDefinition definition) {
        if (definition == null || !StringUtils.hasText(definition.id())) {
            throw new TemplateDefinitionException("Every template requires an id");
        }
        String id = definition.id().trim().toLowerCase(Locale.ROOT);

        List<AnchorToken> anchors = new ArrayList<>();
        if (definition.anchors() != null) {
            for (AnchorDefinition anchor : definition.anchors()) {
                anchors.add(toAnchor(id, anchor));
            }
        }

        String storeName = StringUtils.hasText(definition.storeName()) ? definition.storeName().trim()
            : StringUtils.hasText(definition.displayName()) ? definition.displayName().trim() : id;
        TemplatePatterns patterns = new TemplatePatterns(storeName,
            itemPatterns(id, definition.itemPatterns()),
            totalsKeywords(id, definition.totalsKeywords()),
            datePatterns(id, definition.datePatterns()));

        return new ReceiptTemplate(id, definition.displayName(), anchors,
            new TemplateFieldExtractor(id, patterns, confidencePolicy));
    }

    private static AnchorToken toAnchor(String templateId, AnchorDefinition anchor) {
        if (anchor == null || !StringUtils.hasText(anchor.token())) {
            throw new TemplateDefinitionException("Template '" + templateId + "' declares a blank anchor");
        }
        double weight = anchor.weight() != null ? anchor.weight() : 1.0;
        if (!(weight > 0.0)) {
            throw new TemplateDefinitionException(
                "Template '" + templateId + "' declares non-positive weight for anchor '" + anchor.token() + "'");
        }
        return new AnchorToken(anchor.token(), weight);
    }

    private static List<Pattern> itemPatterns(String templateId, List<String> expressions) {
        List<Pattern> patterns = new ArrayList<>();
        if (expressions == null) {
            return patterns;
        }
        for (String expression : expressions) {
            Pattern pattern = compile(templateId, expression.replace(AMOUNT_PLACEHOLDER, ReceiptAmounts.AMOUNT));
            String source = pattern.pattern();
            if (!source.contains("(?<name>") || !source.contains("(?<amount>")) {
                throw new TemplateDefinitionException(
                    "Item pattern of template '" + templateId + "' must declare 'name' and 'amount' groups");
            }
            patterns.add(pattern);
        }
        return patterns;
    }

    private static Map<TotalsField, Pattern> totalsKeywords(String templateId, Map<String, String> keywords) {
        Map<TotalsField, Pattern> patterns = new EnumMap<>(TotalsField.class);
        if (keywords == null) {
            return patterns;
        }
        for (Map.Entry<String, String> entry : keywords.entrySet()) {
            TotalsField field;
            try {
                field = TotalsField.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new TemplateDefinitionException(
                    "Template '" + templateId + "' declares unknown totals field '" + entry.getKey() + "'", ex);
            }
            patterns.put(field, compile(templateId, entry.getValue()));
        }
        return patterns;
    }

    private static List<TemplateDatePattern> datePatterns(String templateId, List<DatePatternDefinition> definitions) {
        List<TemplateDatePattern> patterns = new ArrayList<>();
        if (definitions == null) {
            return patterns;
        }
        for (DatePatternDefinition definition : definitions) {
            if (definition == null || !StringUtils.hasText(definition.pattern()) || !StringUtils.hasText(definition.format())) {
                throw new TemplateDefinitionException(
                    "Date pattern of template '" + templateId + "' requires a pattern and a format");
            }
            Pattern pattern = compile(templateId, definition.pattern());
            if (!pattern.pattern().contains("(?<date>")) {
                throw new TemplateDefinitionException(
                    "Date pattern of template '" + templateId + "' must declare a 'date' group");
            }
            DateTimeFormatter formatter;
            try {
                formatter = DateTimeFormatter.ofPattern(definition.format(), Locale.US);
            } catch (IllegalArgumentException ex) {
                throw new TemplateDefinitionException(
                    "Template '" + templateId + "' declares invalid date format '" + definition.format() + "'", ex);
            }
            patterns.add(new TemplateDatePattern(pattern, formatter));
        }
        return patterns;
    }

    private static Pattern compile(String templateId, String expression) {
        if (!StringUtils.hasText(expression)) {
            throw new TemplateDefinitionException("Template '" + templateId + "' declares a blank pattern");
        }
        try {
            return Pattern.compile(expression, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException ex) {
            throw new TemplateDefinitionException(
                "Template '" + templateId + "' declares invalid pattern '" + expression + "'", ex);
        }
    }

    record TemplateFile(List<TemplateDefinition> templates) { }

    record TemplateDefinition(
        String id,
        String displayName,
        String storeName,
        List<AnchorDefinition> anchors,
        List<String> itemPatterns,
        Map<String, String> totalsKeywords,
        List<DatePatternDefinition> datePatterns
    ) { }

    record AnchorDefinition(String token, Double weight) { }

    record DatePatternDefinition(String pattern, String format) { }
}
