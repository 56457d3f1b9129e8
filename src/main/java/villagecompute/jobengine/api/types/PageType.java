package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Paginated list envelope.
 *
 * @param items
 *            rows of the requested page
 * @param total
 *            total matching rows
 * @param page
 *            zero-based page index
 * @param size
 *            page size
 */
@Schema(
        description = "Paginated list")
public record PageType<T>(List<T> items, long total, int page, int size) {
}
