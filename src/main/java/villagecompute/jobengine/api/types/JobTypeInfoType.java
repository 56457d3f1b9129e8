package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Registered job type as listed by {@code GET /cron-jobs/types}.
 *
 * @param type
 *            registry key
 * @param mode
 *            QUEUED or INLINE
 * @param description
 *            handler description
 */
@Schema(
        description = "Registered job type")
public record JobTypeInfoType(String type, String mode, String description) {
}
