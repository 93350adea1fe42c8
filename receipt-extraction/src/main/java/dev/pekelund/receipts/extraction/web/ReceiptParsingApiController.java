package dev.pekelund.receipts.extraction.web;

import dev.pekelund.receipts.extraction.assembly.ReceiptParsingResponse;
import dev.pekelund.receipts.extraction.ocr.ImagePayload;
import dev.pekelund.receipts.extraction.pipeline.ReceiptParsingService;
import dev.pekelund.receipts.extraction.template.TemplateRegistry;
import dev.pekelund.receipts.extraction.template.TemplateRegistry.TemplateDescriptor;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * Public REST API for parsing receipt images. Successful parses are answered with 200, parses
 * that could not produce a receipt with 422; both carry a {@link ReceiptParsingResponse}.
 */
@RestController
@RequestMapping(path = "/api/receipts")
public class ReceiptParsingApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptParsingApiController.class);

    private static final String IMAGE_MIME_PREFIX = "image/";
    private static final List<String> IMAGE_EXTENSIONS =
        List.of(".png", ".jpg", ".jpeg", ".gif", ".bmp", ".webp", ".tif", ".tiff");

    private final ReceiptParsingService parsingService;
    private final TemplateRegistry templateRegistry;

    public ReceiptParsingApiController(ReceiptParsingService parsingService, TemplateRegistry templateRegistry) {
        this.parsingService = parsingService;
        this.templateRegistry = templateRegistry;
    }

    @GetMapping(path = "/templates", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TemplateDescriptor> listTemplates() {
        return templateRegistry.describe();
    }

    @PostMapping(path = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReceiptParsingResponse> parseImage(@RequestPart("file") MultipartFile file)
        throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty image must be provided as the 'file' part");
        }
        if (!isImage(file)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Only image uploads are supported");
        }

        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "receipt";
        LOGGER.info("Parsing uploaded receipt image '{}' ({} bytes)", fileName, file.getSize());
        ImagePayload payload = ImagePayload.ofBytes(file.getBytes(), fileName, file.getContentType());
        return toResponseEntity(parsingService.parse(payload));
    }

    @PostMapping(path = "/parse-uri", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReceiptParsingResponse> parseImageUri(@RequestBody ImageUriRequest request) {
        if (request == null || !StringUtils.hasText(request.imageUri())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "An 'imageUri' must be provided");
        }
        LOGGER.info("Parsing receipt image at {}", request.imageUri());
        return toResponseEntity(parsingService.parse(ImagePayload.ofUri(request.imageUri())));
    }

    static ResponseEntity<ReceiptParsingResponse> toResponseEntity(ReceiptParsingResponse response) {
        HttpStatus status = response.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }

    private boolean isImage(MultipartFile file) {
        String contentType = file.getContentType();
        if (StringUtils.hasText(contentType)) {
            return contentType.toLowerCase(Locale.ROOT).startsWith(IMAGE_MIME_PREFIX);
        }
        String name = file.getOriginalFilename();
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    public record ImageUriRequest(String imageUri) { }
}
