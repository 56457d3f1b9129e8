package villagecompute.jobengine.integration.catalog;

/**
 * Outcome of one page of a catalog import or export.
 *
 * @param processed
 *            items written successfully in this page
 * @param failed
 *            items rejected in this page
 * @param nextCursor
 *            cursor of the following page, or null when this was the last one
 * @param totalEstimate
 *            total item count if the remote system reports it, otherwise null
 */
public record CatalogBatch(int processed, int failed, String nextCursor, Long totalEstimate) {

    public boolean hasMore() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
