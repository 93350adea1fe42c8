package dev.pekelund.receipts.extraction.ocr;

public record BoundingBox(int minX, int minY, int maxX, int maxY) {

    public int width() {
        return maxX - minX;
    }

    public int height() {
        return maxY - minY;
    }
}
