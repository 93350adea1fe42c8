package dev.pekelund.receipts.extraction.local;

import dev.pekelund.receipts.extraction.assembly.ReceiptParsingResponse;
import dev.pekelund.receipts.extraction.pipeline.ReceiptParsingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runs the text stages on receipt text posted directly, skipping OCR. Only available with the
 * {@code local-receipt-test} profile.
 */
@RestController
@RequestMapping("/local-receipts")
@Profile("local-receipt-test")
public class LocalReceiptTextController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalReceiptTextController.class);

    private static final String DEFAULT_SOURCE = "local-text";

    private final ReceiptParsingService parsingService;

    public LocalReceiptTextController(ReceiptParsingService parsingService) {
        this.parsingService = parsingService;
    }

    @PostMapping(path = "/parse-text", consumes = MediaType.TEXT_PLAIN_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReceiptParsingResponse> parseText(@RequestBody(required = false) byte[] body,
        @RequestParam(value = "source", required = false) String source) {

        String resolvedSource = StringUtils.hasText(source) ? source : DEFAULT_SOURCE;
        LOGGER.info("Parsing local receipt text from {}", resolvedSource);
        ReceiptParsingResponse response = parsingService.parseText(body != null ? body : new byte[0], resolvedSource);
        HttpStatus status = response.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }
}
