package villagecompute.jobengine.jobs;

import com.google.common.collect.Lists;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.integration.translation.TranslationProvider;
import villagecompute.jobengine.util.PayloadValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a set of keyed texts into one or more languages through a {@link TranslationProvider}.
 *
 * <p>
 * Texts are sent in batches of {@code jobengine.handlers.translation.batch-size}. After every batch the translations
 * so far are checkpointed, so a retried attempt continues where the previous one stopped. Cancellation is checked
 * between batches.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "provider": "deepl",                    // optional when exactly one provider is installed
 *   "source_language": "en",                // optional
 *   "target_languages": ["de", "fr"],
 *   "texts": {"product.42.title": "Blue mug", "product.42.body": "..."}
 * }
 * </pre>
 *
 * The result holds {@code translations}: target language to key to translated text.
 */
@ApplicationScoped
public class TranslationBulkJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(TranslationBulkJobHandler.class);

    public static final String TYPE = "translation:bulk";

    static final String CHECKPOINT_TRANSLATIONS = "translations";
    static final String CHECKPOINT_NEXT_BATCH = "next_batch";

    @Inject
    Instance<TranslationProvider> providers;

    @ConfigProperty(
            name = "jobengine.handlers.translation.batch-size",
            defaultValue = "50")
    int batchSize;

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public String description() {
        return "Translates keyed texts into target languages in batches";
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> execute(Job job, JobContext context) throws Exception {
        TranslationProvider provider = resolveProvider(PayloadValues.optionalString(job.payload, "provider", null));
        String sourceLanguage = PayloadValues.optionalString(job.payload, "source_language", null);
        List<String> targetLanguages = PayloadValues.requireStringList(job.payload, "target_languages");
        Map<String, Object> texts = PayloadValues.optionalMap(job.payload, "texts");
        if (texts.isEmpty()) {
            throw new PermanentExecutionException("Payload field 'texts' must be a non-empty object");
        }

        List<String> keys = new ArrayList<>(texts.keySet());
        List<List<String>> batches = Lists.partition(keys, Math.max(1, batchSize));
        int totalBatches = batches.size() * targetLanguages.size();

        Map<String, Map<String, String>> translations = new LinkedHashMap<>();
        context.checkpointValue(CHECKPOINT_TRANSLATIONS).ifPresent(saved -> ((Map<String, Map<String, String>>) saved)
                .forEach((language, entries) -> translations.put(language, new LinkedHashMap<>(entries))));
        int nextBatch = context.checkpointValue(CHECKPOINT_NEXT_BATCH)
                .map(value -> value instanceof Number number ? number.intValue() : Integer.parseInt(value.toString()))
                .orElse(0);
        if (nextBatch > 0) {
            LOG.infof("Resuming bulk translation at batch %d of %d", nextBatch + 1, totalBatches);
        }

        for (int index = nextBatch; index < totalBatches; index++) {
            context.throwIfCancellationRequested();
            String language = targetLanguages.get(index / batches.size());
            List<String> batchKeys = batches.get(index % batches.size());
            List<String> sources = batchKeys.stream().map(key -> String.valueOf(texts.get(key))).toList();

            List<String> translated = provider.translate(sources, sourceLanguage, language);
            if (translated == null || translated.size() != sources.size()) {
                throw new PermanentExecutionException("Provider " + provider.name() + " returned "
                        + (translated == null ? 0 : translated.size()) + " translations for " + sources.size()
                        + " texts");
            }
            Map<String, String> target = translations.computeIfAbsent(language, l -> new LinkedHashMap<>());
            for (int i = 0; i < batchKeys.size(); i++) {
                target.put(batchKeys.get(i), translated.get(i));
            }

            context.checkpoint(CHECKPOINT_TRANSLATIONS, translations);
            context.checkpoint(CHECKPOINT_NEXT_BATCH, index + 1);
            context.updateProgress((index + 1) * 100 / totalBatches,
                    "Translated batch " + (index + 1) + " of " + totalBatches + " (" + language + ")");
        }

        LOG.infof("Bulk translation via %s finished: %d texts into %s", provider.name(), keys.size(),
                targetLanguages);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("provider", provider.name());
        result.put("texts", keys.size());
        result.put("languages", targetLanguages);
        result.put("translations", translations);
        return result;
    }

    private TranslationProvider resolveProvider(String name) {
        List<TranslationProvider> installed = providers.stream().toList();
        if (name == null || name.isBlank()) {
            if (installed.size() == 1) {
                return installed.get(0);
            }
            throw new PermanentExecutionException(
                    "Payload field 'provider' is required when " + installed.size() + " providers are installed");
        }
        return installed.stream().filter(provider -> provider.name().equals(name)).findFirst()
                .orElseThrow(() -> new PermanentExecutionException("Unknown translation provider '" + name + "'"));
    }
}
