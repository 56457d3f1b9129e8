package villagecompute.jobengine.integration.translation;

import java.util.List;

/**
 * Machine translation backend used by the {@code translation:bulk} handler.
 */
public interface TranslationProvider {

    /**
     * Name referenced by the {@code provider} payload field.
     */
    String name();

    /**
     * Translates texts in order; the returned list has the same size as {@code texts}.
     *
     * @param sourceLanguage
     *            BCP 47 tag, or null to let the provider detect it
     */
    List<String> translate(List<String> texts, String sourceLanguage, String targetLanguage) throws Exception;
}
