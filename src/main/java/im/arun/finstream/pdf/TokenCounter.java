package im.arun.finstream.pdf;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token counter using JTokkit (Java port of tiktoken).
 * Measures how much of the downstream model's context a rendered page stream uses.
 */
public class TokenCounter {
    private static final Logger logger = LoggerFactory.getLogger(TokenCounter.class);
    private final EncodingRegistry registry;
    private volatile Encoding cachedEncoding;
    private volatile String cachedModel;

    public TokenCounter() {
        this.registry = Encodings.newDefaultEncodingRegistry();
        this.cachedEncoding = registry.getEncoding(EncodingType.CL100K_BASE);
        this.cachedModel = null;
    }

    /**
     * Count tokens in text for a specific model.
     *
     * @param text  The text to count tokens for
     * @param model The model name (e.g., "gpt-4o"); unknown or null models use cl100k_base
     * @return Number of tokens
     */
    public int countTokens(String text, String model) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return getEncodingCached(model).countTokens(text);
    }

    private Encoding getEncodingCached(String model) {
        if (model == null ? cachedModel == null : model.equals(cachedModel)) {
            return cachedEncoding;
        }

        Encoding encoding = resolveEncoding(model);
        cachedModel = model;
        cachedEncoding = encoding;
        return encoding;
    }

    private Encoding resolveEncoding(String model) {
        if (model == null) {
            return registry.getEncoding(EncodingType.CL100K_BASE);
        }
        return registry.getEncodingForModel(model).orElseGet(() -> {
            logger.debug("No encoding registered for model {}, using cl100k_base", model);
            return registry.getEncoding(EncodingType.CL100K_BASE);
        });
    }
}
