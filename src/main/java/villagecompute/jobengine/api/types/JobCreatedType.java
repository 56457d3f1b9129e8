package villagecompute.jobengine.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(
        description = "Identifier of an enqueued job")
public record JobCreatedType(Long jobId) {
}
