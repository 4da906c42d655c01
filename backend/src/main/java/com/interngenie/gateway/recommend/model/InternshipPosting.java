package com.interngenie.gateway.recommend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InternshipPosting(
    long id,
    String title,
    String company,
    String location,
    String description,
    String requiredSkills,
    String preferredSkills,
    String duration,
    String stipend,
    String applicationDeadline,
    String postedDate,
    @JsonProperty("is_active") boolean active,
    String minEducation,
    int experienceRequired
) {
}
