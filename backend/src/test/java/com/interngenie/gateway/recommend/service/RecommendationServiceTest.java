package com.interngenie.gateway.recommend.service;

import com.interngenie.gateway.config.RecommendationProperties;
import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;
import com.interngenie.gateway.recommend.model.RecommendationResponse;
import com.interngenie.gateway.recommend.model.ScoredRecommendation;
import com.interngenie.gateway.recommend.persistence.ProfilePostingStore;
import com.interngenie.gateway.recommend.scoring.ExplanationGenerator;
import com.interngenie.gateway.recommend.scoring.MatchScorer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {

    @Mock
    private ProfilePostingStore store;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void sortsByScoreAndKeepsPostingOrderOnTies() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 0));
        when(store.findActivePostings()).thenReturn(List.of(
            posting(1L, "Remote", 0),
            posting(2L, "Austin, TX", 0),
            posting(3L, "Remote", 0),
            posting(4L, "Denver", 0)
        ));

        RecommendationResponse response = createService(new RecommendationProperties()).recommend(7L, 10);

        assertThat(response.success()).isTrue();
        assertThat(response.message()).isEqualTo(RecommendationService.SUCCESS_MESSAGE);
        assertThat(response.recommendations())
            .extracting(recommendation -> recommendation.internship().id())
            .containsExactly(2L, 1L, 3L, 4L);
        assertThat(response.total()).isEqualTo(4);
    }

    @Test
    void limitZeroReturnsNothing() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 0));
        when(store.findActivePostings()).thenReturn(List.of(posting(1L, "Austin", 0), posting(2L, "Remote", 0)));

        RecommendationResponse response = createService(new RecommendationProperties()).recommend(7L, 0);

        assertThat(response.recommendations()).isEmpty();
        assertThat(response.total()).isZero();
    }

    @Test
    void truncatesToLimitKeepingHighestScores() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 1));
        when(store.findActivePostings()).thenReturn(List.of(
            posting(1L, "Remote", 4),
            posting(2L, "Austin", 0),
            posting(3L, "Remote", 0)
        ));

        RecommendationResponse response = createService(new RecommendationProperties()).recommend(7L, 2);

        assertThat(response.recommendations())
            .extracting(recommendation -> recommendation.internship().id())
            .containsExactly(2L, 3L);
        assertThat(response.total()).isEqualTo(2);
    }

    @Test
    void appliesConfiguredDefaultLimitWhenMissing() {
        RecommendationProperties properties = new RecommendationProperties();
        properties.setDefaultLimit(3);
        List<InternshipPosting> postings = new ArrayList<>();
        for (long id = 1; id <= 6; id++) {
            postings.add(posting(id, "Remote", 0));
        }
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 0));
        when(store.findActivePostings()).thenReturn(postings);

        RecommendationResponse response = createService(properties).recommend(7L, null);

        assertThat(response.recommendations()).hasSize(3);
        assertThat(response.total()).isEqualTo(3);
    }

    @Test
    void emptyPostingsYieldEmptyRanking() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 0));
        when(store.findActivePostings()).thenReturn(List.of());

        RecommendationResponse response = createService(new RecommendationProperties()).recommend(7L, 5);

        assertThat(response.success()).isTrue();
        assertThat(response.recommendations()).isEmpty();
        assertThat(response.total()).isZero();
    }

    @Test
    void unknownProfileIsNotFound() {
        when(store.findProfileById(99L)).thenReturn(null);

        RecommendationService service = createService(new RecommendationProperties());

        assertThatThrownBy(() -> service.recommend(99L, 5))
            .isInstanceOf(ProfileNotFoundException.class)
            .hasMessageContaining("99");
        verify(store, never()).findActivePostings();
    }

    @Test
    void rejectsNegativeProfileExperience() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", -1));
        when(store.findActivePostings()).thenReturn(List.of(posting(1L, "Austin", 0)));

        RecommendationService service = createService(new RecommendationProperties());

        assertThatThrownBy(() -> service.recommend(7L, 5))
            .isInstanceOf(MalformedRecordException.class)
            .hasMessageContaining("experience_years");
    }

    @Test
    void rejectsNegativeRequiredExperience() {
        when(store.findProfileById(7L)).thenReturn(profile(7L, "Austin", 2));
        when(store.findActivePostings()).thenReturn(List.of(posting(1L, "Austin", 0), posting(2L, "Austin", -3)));

        RecommendationService service = createService(new RecommendationProperties());

        assertThatThrownBy(() -> service.recommend(7L, 5))
            .isInstanceOf(MalformedRecordException.class)
            .hasMessageContaining("Internship 2");
    }

    @Test
    void parallelScoringMatchesSequentialOrder() {
        List<InternshipPosting> postings = new ArrayList<>();
        for (long id = 1; id <= 40; id++) {
            postings.add(posting(id, id % 3 == 0 ? "Austin" : "Remote", (int) (id % 4)));
        }
        CandidateProfile profile = profile(7L, "Austin", 2);

        List<ScoredRecommendation> sequential = createService(new RecommendationProperties())
            .rank(profile, postings, 40);

        RecommendationProperties parallel = new RecommendationProperties();
        parallel.setScoringParallelism(4);
        parallel.setParallelThreshold(1);
        List<ScoredRecommendation> concurrent = createService(parallel).rank(profile, postings, 40);

        assertThat(concurrent).containsExactlyElementsOf(sequential);
    }

    private RecommendationService createService(RecommendationProperties properties) {
        return new RecommendationService(store, new MatchScorer(), new ExplanationGenerator(), executor, properties);
    }

    private static CandidateProfile profile(long id, String location, int experienceYears) {
        return new CandidateProfile(id, "c" + id + "@example.com", "Candidate " + id, "Bachelors",
            "Java, SQL", location, experienceYears, null, null, null);
    }

    private static InternshipPosting posting(long id, String location, int experienceRequired) {
        return new InternshipPosting(id, "Intern " + id, "Company " + id, location, null, "Go, Rust", null,
            null, null, null, null, true, "Masters", experienceRequired);
    }
}
