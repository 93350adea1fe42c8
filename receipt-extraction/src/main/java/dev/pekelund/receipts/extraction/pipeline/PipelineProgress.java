package dev.pekelund.receipts.extraction.pipeline;

/**
 * Tracks the state of one request. Stages may be skipped but never revisited.
 */
final class PipelineProgress {

    private PipelineStage current;

    PipelineProgress() {
        this(PipelineStage.RECEIVED);
    }

    PipelineProgress(PipelineStage start) {
        this.current = start;
        ReceiptProcessingMdc.setStage(start.logName());
    }

    void advanceTo(PipelineStage next) {
        if (next.compareTo(current) <= 0) {
            throw new IllegalStateException("Cannot move from " + current + " to " + next);
        }
        current = next;
        ReceiptProcessingMdc.setStage(next.logName());
    }

    PipelineStage current() {
        return current;
    }
}
