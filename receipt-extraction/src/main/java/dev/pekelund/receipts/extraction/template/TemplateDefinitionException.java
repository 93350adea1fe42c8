package dev.pekelund.receipts.extraction.template;

/**
 * Raised at startup when the template resource can not be read or declares an invalid template.
 */
public class TemplateDefinitionException extends RuntimeException {

    public TemplateDefinitionException(String message) {
        super(message);
    }

    public TemplateDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
