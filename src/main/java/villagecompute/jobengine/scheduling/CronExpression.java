package villagecompute.jobengine.scheduling;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import villagecompute.jobengine.exceptions.ScheduleMisconfiguredException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Five-field Unix cron expression: {@code minute hour day-of-month month day-of-week}, parsed and evaluated by
 * cron-utils.
 *
 * <p>
 * On top of the Unix definition this accepts the macros {@code @hourly @daily @midnight @weekly @monthly @yearly
 * @annually}, {@code ?} as a synonym for {@code *}, and month or day names in any case.
 *
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class CronExpression {

    private static final CronDefinition UNIX = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    /**
     * Bound on re-searches when a fall-back overlap makes the library return a slot that is not after the reference.
     */
    static final int MAX_OVERLAP_STEPS = 8;

    private static final Map<String, String> MACROS = Map.of("@yearly", "0 0 1 1 *", "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *", "@weekly", "0 0 * * 0", "@daily", "0 0 * * *", "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *");

    private final String expression;
    private final ExecutionTime executionTime;

    private CronExpression(String expression, ExecutionTime executionTime) {
        this.expression = expression;
        this.executionTime = executionTime;
    }

    /**
     * Parses an expression.
     *
     * @throws ScheduleMisconfiguredException
     *             on any syntax error or out-of-range value
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleMisconfiguredException("Cron expression is required");
        }
        String trimmed = expression.trim();
        String unix = toUnix(trimmed);
        try {
            Cron cron = new CronParser(UNIX).parse(unix);
            cron.validate();
            return new CronExpression(trimmed, ExecutionTime.forCron(cron));
        } catch (RuntimeException e) {
            throw new ScheduleMisconfiguredException(
                    "Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }

    /**
     * Resolves an IANA zone id. Null or blank means UTC.
     *
     * @throws ScheduleMisconfiguredException
     *             for an unknown zone
     */
    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of("UTC");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ScheduleMisconfiguredException("Unknown timezone '" + timezone + "'", e);
        }
    }

    /**
     * Earliest occurrence strictly after {@code after}, evaluated on the wall clock of {@code zone}.
     *
     * <p>
     * A wall-clock slot repeated by a fall-back transition resolves to whichever of its two instants is the first one
     * after the reference.
     *
     * @throws ScheduleMisconfiguredException
     *             if the expression has no further occurrence
     */
    public Instant nextAfter(Instant after, ZoneId zone) {
        ZonedDateTime cursor = ZonedDateTime.ofInstant(after, zone);
        for (int step = 0; step < MAX_OVERLAP_STEPS; step++) {
            ZonedDateTime candidate = executionTime.nextExecution(cursor).orElseThrow(this::noOccurrence);
            if (candidate.toInstant().isAfter(after)) {
                return candidate.toInstant();
            }
            ZonedDateTime later = candidate.withLaterOffsetAtOverlap();
            if (later.toInstant().isAfter(after)) {
                return later.toInstant();
            }
            // Slots fall on whole minutes; resume half a minute past the repeated slot.
            cursor = later.plusSeconds(30);
        }
        throw noOccurrence();
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }

    private ScheduleMisconfiguredException noOccurrence() {
        return new ScheduleMisconfiguredException("Cron expression '" + expression + "' has no next occurrence");
    }

    private static String toUnix(String expression) {
        if (expression.startsWith("@")) {
            String macro = MACROS.get(expression.toLowerCase(Locale.ROOT));
            if (macro == null) {
                throw new ScheduleMisconfiguredException("Unknown cron macro '" + expression + "'");
            }
            return macro;
        }
        String[] fields = expression.split("\\s+");
        StringBuilder unix = new StringBuilder();
        for (String field : fields) {
            if (unix.length() > 0) {
                unix.append(' ');
            }
            unix.append("?".equals(field) ? "*" : field.toUpperCase(Locale.ROOT));
        }
        return unix.toString();
    }
}
