package com.interngenie.gateway.recommend.model;

public record CandidateProfile(
    long id,
    String email,
    String name,
    String education,
    String skills,
    String location,
    int experienceYears,
    String phone,
    String linkedin,
    String github
) {
}
