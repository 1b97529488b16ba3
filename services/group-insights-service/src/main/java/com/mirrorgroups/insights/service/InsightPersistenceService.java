package com.mirrorgroups.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.entity.GroupInsightRecord;
import com.mirrorgroups.insights.entity.InsightType;
import com.mirrorgroups.insights.exception.InsightPersistenceException;
import com.mirrorgroups.insights.model.insight.CollectiveStrength;
import com.mirrorgroups.insights.model.insight.CompatibilityMatrix;
import com.mirrorgroups.insights.model.insight.GroupAnalysisResult;
import com.mirrorgroups.insights.model.insight.PairCompatibility;
import com.mirrorgroups.insights.repository.GroupInsightRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Stores an analysis result as one record per insight type plus the pair score rows.
 *
 * <p>Both tables are written with {@code INSERT ... ON CONFLICT DO UPDATE}, so two
 * processes analysing the same group at once never collide on the unique keys; the
 * later write wins. Pair rows left over from members who are no longer in the group
 * are deleted. Everything happens in one transaction.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InsightPersistenceService {

    static final String UPSERT_INSIGHT_SQL = """
        INSERT INTO group_insights (
            id, group_id, insight_type, analysis_id, payload,
            confidence_score, generated_at, expires_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (group_id, insight_type)
        DO UPDATE SET
            analysis_id = EXCLUDED.analysis_id,
            payload = EXCLUDED.payload,
            confidence_score = EXCLUDED.confidence_score,
            generated_at = EXCLUDED.generated_at,
            expires_at = EXCLUDED.expires_at
        """;

    static final String UPSERT_PAIR_SQL = """
        INSERT INTO group_compatibility_scores (
            id, group_id, member_a, member_b, score, confidence, factors, calculated_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (group_id, member_a, member_b)
        DO UPDATE SET
            score = EXCLUDED.score,
            confidence = EXCLUDED.confidence,
            factors = EXCLUDED.factors,
            calculated_at = EXCLUDED.calculated_at
        """;

    static final String DELETE_STALE_PAIRS_SQL =
        "DELETE FROM group_compatibility_scores WHERE group_id = ? AND calculated_at < ?";

    private final GroupInsightRecordRepository insightRepository;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final GroupInsightsProperties properties;
    private final Clock clock;

    /**
     * @throws InsightPersistenceException when serialization or a database write fails;
     *         the transaction is rolled back
     */
    @Transactional
    public void persist(GroupAnalysisResult result) {
        String groupId = result.getGroupId();
        LocalDateTime now = LocalDateTime.now(clock);
        Timestamp generatedAt = Timestamp.valueOf(now);
        Timestamp expiresAt = Timestamp.valueOf(now.plus(properties.getAnalysis().getInsightRetention()));
        double overallConfidence = result.getMetadata() != null ? result.getMetadata().getOverallConfidence() : 0.0;

        try {
            List<Object[]> records = new ArrayList<>();
            records.add(record(groupId, InsightType.FULL_ANALYSIS, result.getAnalysisId(), result,
                overallConfidence, generatedAt, expiresAt));

            CompatibilityMatrix compatibility = result.getCompatibility();
            if (compatibility != null) {
                records.add(record(groupId, InsightType.COMPATIBILITY, result.getAnalysisId(), compatibility,
                    compatibility.meanPairConfidence(), generatedAt, expiresAt));
            }
            if (result.getStrengths() != null) {
                records.add(record(groupId, InsightType.STRENGTHS, result.getAnalysisId(), result.getStrengths(),
                    meanStrengthConfidence(result.getStrengths()), generatedAt, expiresAt));
            }
            if (result.getRisks() != null) {
                records.add(record(groupId, InsightType.RISKS, result.getAnalysisId(), result.getRisks(),
                    null, generatedAt, expiresAt));
            }
            if (result.getGoalAlignment() != null) {
                records.add(record(groupId, InsightType.GOAL_ALIGNMENT, result.getAnalysisId(), result.getGoalAlignment(),
                    null, generatedAt, expiresAt));
            }
            if (result.getSynthesis() != null) {
                records.add(record(groupId, InsightType.SYNTHESIS, result.getAnalysisId(), result.getSynthesis(),
                    null, generatedAt, expiresAt));
            }

            jdbcTemplate.batchUpdate(UPSERT_INSIGHT_SQL, records);
            if (compatibility != null) {
                replacePairScores(groupId, compatibility, generatedAt);
            }
            log.debug("Wrote {} insight records for analysis {} of group {}",
                records.size(), result.getAnalysisId(), groupId);

        } catch (JsonProcessingException e) {
            throw new InsightPersistenceException("Could not serialize insights for group " + groupId, e);
        } catch (DataAccessException e) {
            throw new InsightPersistenceException("Could not store insights for group " + groupId, e);
        }
    }

    @Transactional(readOnly = true)
    public List<GroupInsightRecord> findInsights(String groupId) {
        return insightRepository.findByGroupId(groupId);
    }

    private Object[] record(String groupId, InsightType type, String analysisId, Object payload,
                            Double confidence, Timestamp generatedAt, Timestamp expiresAt)
            throws JsonProcessingException {
        return new Object[] {
            UUID.randomUUID(), groupId, type.name(), analysisId,
            objectMapper.writeValueAsString(payload), confidence, generatedAt, expiresAt
        };
    }

    private void replacePairScores(String groupId, CompatibilityMatrix compatibility, Timestamp calculatedAt)
            throws JsonProcessingException {
        List<Object[]> rows = new ArrayList<>();
        for (PairCompatibility pair : compatibility.getPairs().values()) {
            rows.add(new Object[] {
                UUID.randomUUID(), groupId, pair.getMemberA(), pair.getMemberB(),
                pair.getScore(), pair.getConfidence(),
                objectMapper.writeValueAsString(pair.getFactors()), calculatedAt
            });
        }
        jdbcTemplate.batchUpdate(UPSERT_PAIR_SQL, rows);
        int removed = jdbcTemplate.update(DELETE_STALE_PAIRS_SQL, groupId, calculatedAt);
        log.debug("Upserted {} pair scores and removed {} stale ones for group {}", rows.size(), removed, groupId);
    }

    private static Double meanStrengthConfidence(List<CollectiveStrength> strengths) {
        if (strengths.isEmpty()) {
            return null;
        }
        return strengths.stream()
            .collect(Collectors.averagingDouble(CollectiveStrength::getConfidence));
    }
}
