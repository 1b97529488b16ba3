package com.mirrorgroups.insights.service;

import com.mirrorgroups.insights.engine.CompatibilityEngine;
import com.mirrorgroups.insights.engine.GoalAlignmentCalculator;
import com.mirrorgroups.insights.engine.RiskPredictor;
import com.mirrorgroups.insights.engine.StrengthDetector;
import com.mirrorgroups.insights.event.AnalysisEventPublisher;
import com.mirrorgroups.insights.exception.EngineFailureException;
import com.mirrorgroups.insights.exception.InsightPersistenceException;
import com.mirrorgroups.insights.exception.InsufficientDataException;
import com.mirrorgroups.insights.model.insight.AnalysisMetadata;
import com.mirrorgroups.insights.model.insight.AnalysisOptions;
import com.mirrorgroups.insights.model.insight.CollectiveStrength;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.ConflictRisk;
import com.mirrorgroups.insights.model.insight.GoalAlignment;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.NarrativeSynthesis;
import com.mirrorgroups.insights.model.insight.SynthesisStrategy;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.synthesis.NarrativeSynthesizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Group Analysis Orchestrator
 *
 * Runs one complete analysis of a group:
 * 1. Serve a fresh cached result unless a refresh is forced
 * 2. Load and decrypt the shared member profiles (at least two members required)
 * 3. Fan the enabled engines out on the insight executor; a failed engine only
 *    removes its own block from the result
 * 4. Aggregate confidence and apply the confidence threshold
 * 5. Synthesize the narrative once every engine has settled
 * 6. Cache, persist and announce the result
 *
 * Persistence failures, including those raised when the transaction commits, are
 * logged; the computed result is still cached, announced and returned.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Service
@Slf4j
public class GroupAnalysisOrchestrator {

    static final String COMPATIBILITY_ALGORITHM = "compatibility_matrix_v1";
    static final String STRENGTH_ALGORITHM = "strength_detection_v1";
    static final String RISK_ALGORITHM = "conflict_prediction_v1";
    static final String GOAL_ALGORITHM = "goal_alignment_v1";
    static final String REMOTE_SYNTHESIS_ALGORITHM = "llm_synthesis_v1";
    static final String TEMPLATE_SYNTHESIS_ALGORITHM = "template_synthesis_v1";

    static final int MINIMUM_MEMBERS = 2;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private final MemberProfileLoader profileLoader;
    private final CompatibilityEngine compatibilityEngine;
    private final StrengthDetector strengthDetector;
    private final RiskPredictor riskPredictor;
    private final GoalAlignmentCalculator goalAlignmentCalculator;
    private final NarrativeSynthesizer narrativeSynthesizer;
    private final InsightPersistenceService persistenceService;
    private final InsightCache insightCache;
    private final AnalysisEventPublisher eventPublisher;
    private final Executor insightExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public GroupAnalysisOrchestrator(MemberProfileLoader profileLoader,
                                     CompatibilityEngine compatibilityEngine,
                                     StrengthDetector strengthDetector,
                                     RiskPredictor riskPredictor,
                                     GoalAlignmentCalculator goalAlignmentCalculator,
                                     NarrativeSynthesizer narrativeSynthesizer,
                                     InsightPersistenceService persistenceService,
                                     InsightCache insightCache,
                                     AnalysisEventPublisher eventPublisher,
                                     @Qualifier("insightExecutor") Executor insightExecutor,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.profileLoader = profileLoader;
        this.compatibilityEngine = compatibilityEngine;
        this.strengthDetector = strengthDetector;
        this.riskPredictor = riskPredictor;
        this.goalAlignmentCalculator = goalAlignmentCalculator;
        this.narrativeSynthesizer = narrativeSynthesizer;
        this.persistenceService = persistenceService;
        this.insightCache = insightCache;
        this.eventPublisher = eventPublisher;
        this.insightExecutor = insightExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public GroupAnalysisResult analyzeGroup(String groupId) {
        return analyzeGroup(groupId, AnalysisOptions.defaults());
    }

    /**
     * @throws InsufficientDataException when fewer than two members have shared readable data
     * @throws com.mirrorgroups.insights.exception.SynthesisException when remote synthesis fails
     */
    public GroupAnalysisResult analyzeGroup(String groupId, AnalysisOptions options) {
        if (!options.isForceRefresh()) {
            Optional<GroupAnalysisResult> cached = insightCache.get(groupId);
            if (cached.isPresent()) {
                log.debug("Serving cached analysis {} for group {}", cached.get().getAnalysisId(), groupId);
                meterRegistry.counter("insights.analysis.cache", "result", "hit").increment();
                return cached.get();
            }
            meterRegistry.counter("insights.analysis.cache", "result", "miss").increment();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        long started = System.nanoTime();
        log.info("Starting analysis of group {} (forceRefresh={})", groupId, options.isForceRefresh());

        List<MemberProfile> members = profileLoader.load(groupId);
        if (members.size() < MINIMUM_MEMBERS) {
            log.warn("Group {} has {} members with shared data, analysis skipped", groupId, members.size());
            throw new InsufficientDataException(groupId, members.size());
        }
        double completeness = dataCompleteness(members);

        CompletableFuture<EngineOutcome<CompatibilityMatrix>> compatibilityFuture =
            runEngine("compatibility", options.isIncludeCompatibility(), () -> compatibilityEngine.calculate(members));
        CompletableFuture<EngineOutcome<List<CollectiveStrength>>> strengthsFuture =
            runEngine("strengths", options.isIncludeStrengths(), () -> strengthDetector.detect(members));
        CompletableFuture<EngineOutcome<List<ConflictRisk>>> risksFuture =
            runEngine("risks", options.isIncludeRisks(), () -> riskPredictor.predict(members));
        CompletableFuture<EngineOutcome<GoalAlignment>> goalsFuture =
            runEngine("goal_alignment", options.isIncludeGoalAlignment(), () -> goalAlignmentCalculator.calculate(members));

        CompletableFuture.allOf(compatibilityFuture, strengthsFuture, risksFuture, goalsFuture).join();

        CompatibilityMatrix compatibility = resolve(groupId, compatibilityFuture);
        List<CollectiveStrength> strengths = resolve(groupId, strengthsFuture);
        List<ConflictRisk> risks = resolve(groupId, risksFuture);
        GoalAlignment goalAlignment = resolve(groupId, goalsFuture);

        double overallConfidence = overallConfidence(completeness, compatibility, strengths);
        double threshold = options.getConfidenceThreshold();

        List<String> algorithms = new ArrayList<>();
        if (compatibility != null) {
            algorithms.add(COMPATIBILITY_ALGORITHM);
        }
        if (strengths != null) {
            algorithms.add(STRENGTH_ALGORITHM);
            strengths = strengths.stream()
                .filter(s -> s.getConfidence() >= threshold)
                .collect(Collectors.toList());
        }
        if (risks != null) {
            algorithms.add(RISK_ALGORITHM);
            risks = risks.stream()
                .filter(r -> r.getProbability() >= threshold)
                .collect(Collectors.toList());
        }
        if (goalAlignment != null) {
            algorithms.add(GOAL_ALGORITHM);
        }

        GroupAnalysisResult result = GroupAnalysisResult.builder()
            .groupId(groupId)
            .analysisId(UUID.randomUUID().toString())
            .timestamp(Instant.now(clock))
            .memberCount(members.size())
            .dataCompleteness(completeness)
            .compatibility(compatibility)
            .strengths(strengths)
            .risks(risks)
            .goalAlignment(goalAlignment)
            .metadata(metadata(0, members, algorithms, overallConfidence))
            .build();

        if (options.isIncludeSynthesis() && result.hasAnyInsight()) {
            NarrativeSynthesis synthesis = narrativeSynthesizer.synthesize(result);
            algorithms.add(synthesis.getStrategy() == SynthesisStrategy.REMOTE
                ? REMOTE_SYNTHESIS_ALGORITHM
                : TEMPLATE_SYNTHESIS_ALGORITHM);
            result = result.toBuilder().synthesis(synthesis).build();
        }

        long processingTimeMs = (System.nanoTime() - started) / 1_000_000;
        result = result.toBuilder()
            .metadata(metadata(processingTimeMs, members, algorithms, overallConfidence))
            .build();

        insightCache.put(result);
        try {
            persistenceService.persist(result);
        } catch (InsightPersistenceException | DataAccessException | TransactionException e) {
            // commit-time failures surface from the transaction proxy, outside persist()
            log.error("Failed to persist analysis {} for group {}", result.getAnalysisId(), groupId, e);
            meterRegistry.counter("insights.persistence.failures").increment();
        }
        eventPublisher.publishCompleted(result);

        sample.stop(meterRegistry.timer("insights.analysis.duration"));
        meterRegistry.counter("insights.analysis.completed").increment();
        log.info("Completed analysis {} for group {}: {} members, confidence {}, {} ms",
            result.getAnalysisId(), groupId, members.size(),
            String.format("%.2f", overallConfidence), processingTimeMs);
        return result;
    }

    /**
     * Drops the cached analysis so the next request recomputes it
     */
    public void invalidate(String groupId) {
        insightCache.evict(groupId);
        log.debug("Invalidated cached analysis for group {}", groupId);
    }

    static double dataCompleteness(List<MemberProfile> members) {
        if (members.isEmpty()) {
            return 0.0;
        }
        int present = 0;
        for (MemberProfile member : members) {
            if (member.embedding().isPresent()) present++;
            if (member.hasTraits()) present++;
            if (member.hasTendencies()) present++;
            if (member.hasMotivationDrivers()) present++;
        }
        return present / (members.size() * 4.0);
    }

    static double overallConfidence(double completeness, CompatibilityMatrix compatibility,
                                    List<CollectiveStrength> strengths) {
        List<Double> available = new ArrayList<>();
        if (compatibility != null && compatibility.pairCount() > 0) {
            available.add(compatibility.meanPairConfidence());
        }
        if (strengths != null && !strengths.isEmpty()) {
            available.add(strengths.stream().mapToDouble(CollectiveStrength::getConfidence).average().orElse(0.0));
        }
        double mean = available.isEmpty()
            ? DEFAULT_CONFIDENCE
            : available.stream().mapToDouble(Double::doubleValue).average().orElse(DEFAULT_CONFIDENCE);
        return Math.min(1.0, completeness * mean);
    }

    /**
     * "v1_" plus the base-36 sum of the members' share timestamps; changes whenever any
     * member re-shares
     */
    static String dataVersion(List<MemberProfile> members) {
        long sum = members.stream()
            .filter(m -> m.getSharedAt() != null)
            .mapToLong(m -> m.getSharedAt().toEpochMilli())
            .sum();
        return "v1_" + Long.toString(sum, 36);
    }

    private AnalysisMetadata metadata(long processingTimeMs, List<MemberProfile> members,
                                      List<String> algorithms, double overallConfidence) {
        return AnalysisMetadata.builder()
            .processingTimeMs(processingTimeMs)
            .dataVersion(dataVersion(members))
            .algorithmsUsed(List.copyOf(algorithms))
            .overallConfidence(overallConfidence)
            .build();
    }

    private <T> CompletableFuture<EngineOutcome<T>> runEngine(String engine, boolean enabled, Supplier<T> computation) {
        if (!enabled) {
            return CompletableFuture.completedFuture(EngineOutcome.skipped(engine));
        }
        return CompletableFuture.supplyAsync(computation, insightExecutor)
            .handle((value, error) -> error == null
                ? EngineOutcome.succeeded(engine, value)
                : EngineOutcome.<T>failed(engine, new EngineFailureException(engine, unwrap(error))));
    }

    private <T> T resolve(String groupId, CompletableFuture<EngineOutcome<T>> future) {
        EngineOutcome<T> outcome = future.join();
        if (outcome.getFailure() != null) {
            log.error("Engine {} failed for group {}, omitting its insights",
                outcome.getEngine(), groupId, outcome.getFailure());
            meterRegistry.counter("insights.engine.failures", "engine", outcome.getEngine()).increment();
        }
        return outcome.getValue();
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
