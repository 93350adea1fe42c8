package dev.pekelund.receipts.extraction.persistence;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.Firestore;
import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.Receipt;
import dev.pekelund.receipts.model.ReceiptItem;
import dev.pekelund.receipts.model.ReceiptTotals;
import dev.pekelund.receipts.model.Store;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes assembled receipts to a Firestore collection, one document per receipt. The document
 * mirrors the {@link Receipt} record; amounts are stored as doubles and the date as an ISO string.
 */
public class FirestoreReceiptRecordStore implements ReceiptRecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreReceiptRecordStore.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreReceiptRecordStore(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreReceiptRecordStore initialized with collection '{}'", collectionName);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String save(Receipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        Map<String, Object> payload = toPayload(receipt);
        try {
            DocumentReference documentReference = firestore.collection(collectionName).document();
            String documentId = documentReference.getId();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Firestore payload for {}/{}: {}", collectionName, documentId, payload);
            }
            documentReference.set(payload).get();
            LOGGER.info("Stored receipt with {} items in Firestore document {}/{}", receipt.items().size(),
                collectionName, documentId);
            return documentId;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReceiptStorageException("Interrupted while writing receipt to Firestore", ex);
        } catch (ExecutionException ex) {
            throw new ReceiptStorageException("Failed to write receipt to Firestore", ex.getCause() != null
                ? ex.getCause() : ex);
        } catch (RuntimeException ex) {
            throw new ReceiptStorageException("Failed to write receipt to Firestore", ex);
        }
    }

    static Map<String, Object> toPayload(Receipt receipt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("store", storeMap(receipt.store()));
        if (receipt.date() != null) {
            payload.put("date", receipt.date().toString());
        }
        List<Map<String, Object>> items = new ArrayList<>(receipt.items().size());
        for (ReceiptItem item : receipt.items()) {
            items.add(itemMap(item));
        }
        payload.put("items", items);
        payload.put("totals", totalsMap(receipt.totals()));
        if (receipt.paymentInfo() != null) {
            payload.put("paymentInfo", paymentMap(receipt.paymentInfo()));
        }
        payload.put("confidence", receipt.confidence());
        payload.put("rawText", receipt.rawText());
        return payload;
    }

    private static Map<String, Object> storeMap(Store store) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", store.name());
        putIfPresent(map, "address", store.address());
        putIfPresent(map, "phone", store.phone());
        putIfPresent(map, "website", store.website());
        putIfPresent(map, "taxId", store.taxId());
        return map;
    }

    private static Map<String, Object> itemMap(ReceiptItem item) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", item.name());
        map.put("price", item.price().doubleValue());
        map.put("quantity", item.quantity());
        putIfPresent(map, "unitPrice", amount(item.unitPrice()));
        putIfPresent(map, "category", item.category());
        putIfPresent(map, "taxRate", amount(item.taxRate()));
        map.put("confidence", item.confidence());
        return map;
    }

    private static Map<String, Object> totalsMap(ReceiptTotals totals) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("subtotal", totals.subtotal().doubleValue());
        map.put("tax", totals.tax().doubleValue());
        map.put("total", totals.total().doubleValue());
        putIfPresent(map, "tip", amount(totals.tip()));
        putIfPresent(map, "discount", amount(totals.discount()));
        return map;
    }

    private static Map<String, Object> paymentMap(PaymentInfo paymentInfo) {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "method", paymentInfo.method() != null ? paymentInfo.method().name() : null);
        putIfPresent(map, "cardType", paymentInfo.cardType());
        putIfPresent(map, "cardLast4", paymentInfo.cardLast4());
        putIfPresent(map, "transactionId", paymentInfo.transactionId());
        return map;
    }

    private static Double amount(BigDecimal value) {
        return value != null ? value.doubleValue() : null;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
