package dev.pekelund.receipts.extraction.extract;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

final class ItemCategorizer {

    private static final Map<String, Pattern> CATEGORIES = new LinkedHashMap<>();

    static {
        CATEGORIES.put("Dairy", keywords("milk", "cheese", "yogurt", "yoghurt", "cream", "butter"));
        CATEGORIES.put("Bakery", keywords("bread", "bagel", "roll", "bun", "pastry", "cake", "muffin", "croissant"));
        CATEGORIES.put("Meat", keywords("chicken", "beef", "pork", "turkey", "ham", "bacon", "sausage", "steak"));
        CATEGORIES.put("Produce", keywords("apple", "banana", "orange", "lettuce", "tomato", "potato", "onion",
            "carrot", "avocado", "fruit", "vegetable"));
        CATEGORIES.put("Beverages", keywords("water", "soda", "juice", "coffee", "tea", "cola", "beer", "wine",
            "latte"));
        CATEGORIES.put("Household", keywords("towel", "tissue", "detergent", "soap", "paper"));
    }

    private ItemCategorizer() {
    }

    static String categorize(String itemName) {
        if (itemName == null) {
            return null;
        }
        for (Map.Entry<String, Pattern> entry : CATEGORIES.entrySet()) {
            if (entry.getValue().matcher(itemName).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")(?:e?s)?\\b", Pattern.CASE_INSENSITIVE);
    }
}
