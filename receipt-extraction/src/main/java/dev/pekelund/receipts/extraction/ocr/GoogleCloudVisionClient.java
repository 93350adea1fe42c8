package dev.pekelund.receipts.extraction.ocr;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesRequest;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Block;
import com.google.cloud.vision.v1.BoundingPoly;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageContext;
import com.google.cloud.vision.v1.ImageSource;
import com.google.cloud.vision.v1.Page;
import com.google.cloud.vision.v1.Paragraph;
import com.google.cloud.vision.v1.Symbol;
import com.google.cloud.vision.v1.TextAnnotation;
import com.google.cloud.vision.v1.Vertex;
import com.google.cloud.vision.v1.Word;
import com.google.protobuf.ByteString;
import com.google.rpc.Code;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link VisionClient} backed by the Google Cloud Vision document text detection API.
 */
public class GoogleCloudVisionClient implements VisionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleCloudVisionClient.class);

    private static final Set<StatusCode.Code> TRANSIENT_STATUS_CODES = EnumSet.of(
        StatusCode.Code.UNAVAILABLE,
        StatusCode.Code.DEADLINE_EXCEEDED,
        StatusCode.Code.INTERNAL,
        StatusCode.Code.ABORTED,
        StatusCode.Code.UNKNOWN);

    private static final Set<Code> TRANSIENT_RPC_CODES = EnumSet.of(
        Code.UNAVAILABLE,
        Code.DEADLINE_EXCEEDED,
        Code.INTERNAL,
        Code.ABORTED,
        Code.UNKNOWN);

    private final Supplier<ImageAnnotatorClient> clientSupplier;
    private final List<String> languageHints;

    public GoogleCloudVisionClient(Supplier<ImageAnnotatorClient> clientSupplier, List<String> languageHints) {
        this.clientSupplier = Objects.requireNonNull(clientSupplier, "clientSupplier");
        this.languageHints = languageHints != null ? List.copyOf(languageHints) : List.of();
    }

    @Override
    public RawOcrResult detectText(ImagePayload image) {
        Objects.requireNonNull(image, "image");
        BatchAnnotateImagesRequest request = BatchAnnotateImagesRequest.newBuilder()
            .addRequests(buildRequest(image))
            .build();

        ApiFuture<BatchAnnotateImagesResponse> pending;
        try {
            pending = client().batchAnnotateImagesCallable().futureCall(request);
        } catch (ApiException ex) {
            throw classify(ex);
        }
        BatchAnnotateImagesResponse batchResponse = await(pending);

        if (batchResponse == null || batchResponse.getResponsesCount() == 0) {
            throw new TransientOcrServiceException("Vision API returned an empty batch response");
        }

        AnnotateImageResponse response = batchResponse.getResponses(0);
        if (response.hasError() && response.getError().getCode() != Code.OK_VALUE) {
            throw classify(response.getError());
        }
        return toResult(response);
    }

    /**
     * Waits for the in-flight call. An interrupt cancels the call rather than leaving it running
     * after the caller has given up.
     */
    private static BatchAnnotateImagesResponse await(ApiFuture<BatchAnnotateImagesResponse> pending) {
        try {
            return pending.get();
        } catch (InterruptedException ex) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new OcrServiceException("OCR request was cancelled", ex);
        } catch (CancellationException ex) {
            throw new OcrServiceException("OCR request was cancelled", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof ApiException apiException) {
                throw classify(apiException);
            }
            throw new OcrServiceException("Vision API call failed: " + cause.getMessage(), cause);
        }
    }

    private ImageAnnotatorClient client() {
        try {
            return clientSupplier.get();
        } catch (RuntimeException ex) {
            throw new OcrServiceException("Vision API client is not available", ex);
        }
    }

    private AnnotateImageRequest buildRequest(ImagePayload image) {
        Image.Builder imageBuilder = Image.newBuilder();
        if (image.isReference()) {
            imageBuilder.setSource(ImageSource.newBuilder().setImageUri(image.uri()).build());
        } else {
            imageBuilder.setContent(ByteString.copyFrom(image.content()));
        }

        AnnotateImageRequest.Builder requestBuilder = AnnotateImageRequest.newBuilder()
            .setImage(imageBuilder.build())
            .addFeatures(Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build());
        if (!languageHints.isEmpty()) {
            requestBuilder.setImageContext(ImageContext.newBuilder().addAllLanguageHints(languageHints).build());
        }
        return requestBuilder.build();
    }

    private RawOcrResult toResult(AnnotateImageResponse response) {
        String languageCode = null;
        if (response.getTextAnnotationsCount() > 0) {
            languageCode = StringUtils.hasText(response.getTextAnnotations(0).getLocale())
                ? response.getTextAnnotations(0).getLocale()
                : null;
        }

        if (response.hasFullTextAnnotation()) {
            TextAnnotation fullText = response.getFullTextAnnotation();
            List<OcrRegion> regions = extractRegions(fullText);
            LOGGER.debug("Vision API returned {} characters in {} regions", fullText.getText().length(),
                regions.size());
            return new RawOcrResult(fullText.getText(), regions, languageCode);
        }

        if (response.getTextAnnotationsCount() > 0) {
            return new RawOcrResult(response.getTextAnnotations(0).getDescription(), List.of(), languageCode);
        }

        LOGGER.info("Vision API did not detect any text in the image");
        return RawOcrResult.textOnly("");
    }

    private List<OcrRegion> extractRegions(TextAnnotation fullText) {
        List<OcrRegion> regions = new ArrayList<>();
        for (Page page : fullText.getPagesList()) {
            for (Block block : page.getBlocksList()) {
                String text = blockText(block);
                if (!StringUtils.hasText(text)) {
                    continue;
                }
                double confidence = Math.max(0.0, Math.min(1.0, block.getConfidence()));
                regions.add(new OcrRegion(text, confidence, boundingBox(block.getBoundingBox())));
            }
        }
        return regions;
    }

    private String blockText(Block block) {
        return block.getParagraphsList().stream()
            .map(this::paragraphText)
            .filter(StringUtils::hasText)
            .collect(Collectors.joining("\n"));
    }

    private String paragraphText(Paragraph paragraph) {
        return paragraph.getWordsList().stream()
            .map(GoogleCloudVisionClient::wordText)
            .collect(Collectors.joining(" "));
    }

    private static String wordText(Word word) {
        StringBuilder builder = new StringBuilder();
        for (Symbol symbol : word.getSymbolsList()) {
            builder.append(symbol.getText());
        }
        return builder.toString();
    }

    static BoundingBox boundingBox(BoundingPoly polygon) {
        if (polygon == null || polygon.getVerticesCount() == 0) {
            return null;
        }
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (Vertex vertex : polygon.getVerticesList()) {
            minX = Math.min(minX, vertex.getX());
            minY = Math.min(minY, vertex.getY());
            maxX = Math.max(maxX, vertex.getX());
            maxY = Math.max(maxY, vertex.getY());
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }

    static OcrServiceException classify(ApiException exception) {
        StatusCode.Code code = exception.getStatusCode() != null ? exception.getStatusCode().getCode() : null;
        String message = "Vision API call failed with status " + code;
        if (code != null && TRANSIENT_STATUS_CODES.contains(code)) {
            return new TransientOcrServiceException(message, exception);
        }
        return new OcrServiceException(message, exception);
    }

    static OcrServiceException classify(com.google.rpc.Status status) {
        Code code = Code.forNumber(status.getCode());
        String message = "Vision API rejected the image with status " + code + ": " + status.getMessage();
        if (code != null && TRANSIENT_RPC_CODES.contains(code)) {
            return new TransientOcrServiceException(message);
        }
        return new OcrServiceException(message);
    }
}
