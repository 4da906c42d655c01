package com.interngenie.gateway.recommend.service;

import com.interngenie.gateway.config.RecommendationProperties;
import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;
import com.interngenie.gateway.recommend.model.RecommendationResponse;
import com.interngenie.gateway.recommend.model.ScoredRecommendation;
import com.interngenie.gateway.recommend.persistence.ProfilePostingStore;
import com.interngenie.gateway.recommend.scoring.ExplanationGenerator;
import com.interngenie.gateway.recommend.scoring.MatchScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one ranking pass: every active posting is scored against the profile, paired with its
 * explanation, sorted by score (highest first, ties keep posting order) and cut to the limit.
 */
@Service
public class RecommendationService {
    public static final String SUCCESS_MESSAGE = "Recommendations generated successfully";

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);
    private static final Comparator<ScoredRecommendation> BY_SCORE_DESC =
        Comparator.comparingDouble(ScoredRecommendation::score).reversed();

    private final ProfilePostingStore store;
    private final MatchScorer scorer;
    private final ExplanationGenerator explanationGenerator;
    private final ExecutorService scoringExecutor;
    private final RecommendationProperties properties;

    public RecommendationService(
        ProfilePostingStore store,
        MatchScorer scorer,
        ExplanationGenerator explanationGenerator,
        @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
        RecommendationProperties properties
    ) {
        this.store = store;
        this.scorer = scorer;
        this.explanationGenerator = explanationGenerator;
        this.scoringExecutor = scoringExecutor;
        this.properties = properties;
    }

    public RecommendationResponse recommend(long profileId, Integer limit) {
        int safeLimit = limit == null ? properties.getDefaultLimit() : Math.max(0, limit);

        CandidateProfile profile = store.findProfileById(profileId);
        if (profile == null) {
            throw new ProfileNotFoundException(profileId);
        }
        List<InternshipPosting> postings = store.findActivePostings();

        List<ScoredRecommendation> ranked = rank(profile, postings, safeLimit);
        log.info(
            "Ranked {} active postings for profile {}; returning {} (limit={})",
            postings.size(),
            profileId,
            ranked.size(),
            safeLimit
        );
        return new RecommendationResponse(true, ranked, ranked.size(), SUCCESS_MESSAGE);
    }

    public List<ScoredRecommendation> rank(CandidateProfile profile, List<InternshipPosting> postings, int limit) {
        validateProfile(profile);
        for (InternshipPosting posting : postings) {
            validatePosting(posting);
        }

        List<ScoredRecommendation> scored = shouldScoreInParallel(postings)
            ? scoreInParallel(profile, postings)
            : scoreSequentially(profile, postings);

        // List.sort is stable, so equal scores keep posting order.
        scored.sort(BY_SCORE_DESC);
        int end = Math.min(Math.max(0, limit), scored.size());
        return new ArrayList<>(scored.subList(0, end));
    }

    private boolean shouldScoreInParallel(List<InternshipPosting> postings) {
        return properties.isParallelScoring() && postings.size() >= properties.getParallelThreshold();
    }

    private List<ScoredRecommendation> scoreSequentially(CandidateProfile profile, List<InternshipPosting> postings) {
        List<ScoredRecommendation> scored = new ArrayList<>(postings.size());
        for (InternshipPosting posting : postings) {
            scored.add(scoreOne(profile, posting));
        }
        return scored;
    }

    private List<ScoredRecommendation> scoreInParallel(CandidateProfile profile, List<InternshipPosting> postings) {
        List<CompletableFuture<ScoredRecommendation>> futures = new ArrayList<>(postings.size());
        for (InternshipPosting posting : postings) {
            futures.add(CompletableFuture.supplyAsync(() -> scoreOne(profile, posting), scoringExecutor));
        }
        List<ScoredRecommendation> scored = new ArrayList<>(futures.size());
        for (CompletableFuture<ScoredRecommendation> future : futures) {
            try {
                scored.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw e;
            }
        }
        return scored;
    }

    private ScoredRecommendation scoreOne(CandidateProfile profile, InternshipPosting posting) {
        double score = scorer.score(profile, posting);
        String explanation = explanationGenerator.explain(profile, posting, score);
        return new ScoredRecommendation(posting, score, explanation);
    }

    private void validateProfile(CandidateProfile profile) {
        if (profile.experienceYears() < 0) {
            throw new MalformedRecordException(
                "Profile " + profile.id() + " has negative experience_years: " + profile.experienceYears()
            );
        }
    }

    private void validatePosting(InternshipPosting posting) {
        if (posting.experienceRequired() < 0) {
            throw new MalformedRecordException(
                "Internship " + posting.id() + " has negative experience_required: " + posting.experienceRequired()
            );
        }
    }
}
