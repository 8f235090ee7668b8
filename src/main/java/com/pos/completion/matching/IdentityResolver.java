package com.pos.completion.matching;

import com.pos.completion.config.CompletionProperties;
import com.pos.completion.model.IdentityDecision;
import com.pos.completion.model.StoreCatalogEntry;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Decides whether a survey submission refers to a given catalog store.
 *
 * <p>The strategies are evaluated in order and the first one whose confidence
 * reaches the acceptance threshold wins; scores of different strategies are never
 * combined. Default cascade:
 * <ol>
 *   <li>{@link ExactStoreNameStrategy} (1.0)</li>
 *   <li>{@link ExactIdentifierStrategy} (1.0)</li>
 *   <li>{@link StrictPartialNameStrategy} (0.75 - 0.90)</li>
 *   <li>{@link IdentifierInNameStrategy} (0.88)</li>
 *   <li>{@link LeaderLabelInNameStrategy} (0.87)</li>
 * </ol>
 *
 * Stateless and safe to call from multiple worker threads.
 */
@Singleton
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final List<IdentityMatchStrategy> strategies;
    private final double acceptanceThreshold;

    @Inject
    public IdentityResolver(CompletionProperties properties) {
        this(defaultCascade(properties.getIdentity()), properties.getIdentity().getAcceptanceThreshold());
    }

    public IdentityResolver(List<IdentityMatchStrategy> strategies, double acceptanceThreshold) {
        this.strategies = List.copyOf(strategies);
        this.acceptanceThreshold = acceptanceThreshold;
    }

    /**
     * Resolves a submission's labels against one candidate store.
     *
     * @param leaderLabel      submission leader label (may be null)
     * @param shopNameLabel    submission shop name label (may be null)
     * @param candidateStoreId catalog id of the candidate store
     * @param storeCatalog     catalog entries keyed by store id; the candidate may be absent
     * @return the accepting method's decision, or a rejection with confidence 0
     */
    public IdentityDecision resolve(String leaderLabel,
                                    String shopNameLabel,
                                    String candidateStoreId,
                                    Map<String, StoreCatalogEntry> storeCatalog) {
        StoreCatalogEntry candidate = candidateStoreId == null ? null : storeCatalog.get(candidateStoreId);
        IdentityProbe probe = IdentityProbe.of(leaderLabel, shopNameLabel, candidateStoreId, candidate);

        for (IdentityMatchStrategy strategy : strategies) {
            OptionalDouble confidence = strategy.evaluate(probe);
            if (confidence.isPresent() && confidence.getAsDouble() >= acceptanceThreshold) {
                if (log.isDebugEnabled()) {
                    log.debug("Identity accepted store={} shop='{}' leader='{}' method={} confidence={}",
                            candidateStoreId, shopNameLabel, leaderLabel, strategy.method(), confidence.getAsDouble());
                }
                return IdentityDecision.accept(strategy.method(), confidence.getAsDouble());
            }
        }
        return IdentityDecision.reject();
    }

    private static List<IdentityMatchStrategy> defaultCascade(CompletionProperties.Identity identity) {
        return List.of(
                new ExactStoreNameStrategy(),
                new ExactIdentifierStrategy(),
                new StrictPartialNameStrategy(identity.getPartialOverlapThreshold(), identity.getPartialMinSharedTokens()),
                new IdentifierInNameStrategy(identity.getMinIdentifierLength()),
                new LeaderLabelInNameStrategy(identity.getMinIdentifierLength()));
    }
}
