package com.interngenie.gateway.recommend.scoring;

import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;
import com.interngenie.gateway.recommend.util.MatchTextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class ExplanationGenerator {
    public static final String FALLBACK_REASON = "Based on your profile and preferences";

    public String explain(CandidateProfile profile, InternshipPosting posting, double score) {
        List<String> reasons = new ArrayList<>();

        if (MatchTextUtils.locationsOverlap(profile.location(), posting.location())) {
            reasons.add("Location match: " + profile.location() + " and " + posting.location());
        }

        List<String> matchingSkills = MatchTextUtils.matchingSkills(
            MatchTextUtils.splitSkills(profile.skills()),
            MatchTextUtils.splitSkills(posting.requiredSkills())
        );
        if (!matchingSkills.isEmpty()) {
            reasons.add("Skills match: " + String.join(", ", matchingSkills));
        }

        if (profile.experienceYears() >= posting.experienceRequired()) {
            reasons.add("Experience requirement met: " + profile.experienceYears() + " years");
        }

        if (MatchTextUtils.educationSatisfied(profile.education(), posting.minEducation())) {
            reasons.add("Education requirement met: " + posting.minEducation());
        }

        if (reasons.isEmpty()) {
            reasons.add(FALLBACK_REASON);
        }
        return String.format(Locale.ROOT, "Score: %.1f%% - %s", score * 100.0, String.join(", ", reasons));
    }
}
