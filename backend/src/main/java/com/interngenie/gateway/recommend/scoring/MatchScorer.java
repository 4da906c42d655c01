package com.interngenie.gateway.recommend.scoring;

import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;
import com.interngenie.gateway.recommend.util.MatchTextUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Weighted match between one candidate profile and one internship posting.
 *
 * <p>Four independent contributions are summed: location (0.40), skills (0.35), experience (0.15)
 * and education (0.10). The result is clamped to [0, 1].
 */
@Component
public class MatchScorer {
    public static final double LOCATION_WEIGHT = 0.40;
    public static final double SKILLS_WEIGHT = 0.35;
    public static final double EXPERIENCE_WEIGHT = 0.15;
    public static final double EDUCATION_WEIGHT = 0.10;

    public double score(CandidateProfile profile, InternshipPosting posting) {
        double score = locationScore(profile, posting)
            + skillsScore(profile, posting)
            + experienceScore(profile, posting)
            + educationScore(profile, posting);
        return Math.max(0.0, Math.min(1.0, score));
    }

    double locationScore(CandidateProfile profile, InternshipPosting posting) {
        return MatchTextUtils.locationsOverlap(profile.location(), posting.location()) ? LOCATION_WEIGHT : 0.0;
    }

    // Denominator is the required-skill count, so extra profile skills never lower the score.
    double skillsScore(CandidateProfile profile, InternshipPosting posting) {
        List<String> required = MatchTextUtils.splitSkills(posting.requiredSkills());
        if (required.isEmpty()) {
            return 0.0;
        }
        List<String> matching = MatchTextUtils.matchingSkills(
            MatchTextUtils.splitSkills(profile.skills()),
            required
        );
        return SKILLS_WEIGHT * ((double) matching.size() / required.size());
    }

    double experienceScore(CandidateProfile profile, InternshipPosting posting) {
        if (profile.experienceYears() >= posting.experienceRequired()) {
            return EXPERIENCE_WEIGHT;
        }
        // required > profile >= 0 here
        return EXPERIENCE_WEIGHT * ((double) profile.experienceYears() / posting.experienceRequired());
    }

    double educationScore(CandidateProfile profile, InternshipPosting posting) {
        return MatchTextUtils.educationSatisfied(profile.education(), posting.minEducation()) ? EDUCATION_WEIGHT : 0.0;
    }
}
