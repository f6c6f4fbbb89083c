package ai.scopeview.analyzer.context;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/** Exact token counts with the cl100k_base BPE encoding. */
public final class JtokkitTokenEstimator implements TokenEstimator {
    private static final EncodingRegistry REGISTRY = Encodings.newLazyEncodingRegistry();

    private final Encoding encoding;

    public JtokkitTokenEstimator() {
        this(EncodingType.CL100K_BASE);
    }

    public JtokkitTokenEstimator(EncodingType type) {
        this.encoding = REGISTRY.getEncoding(type);
    }

    @Override
    public int estimate(String text) {
        return text.isEmpty() ? 0 : encoding.countTokens(text);
    }
}
