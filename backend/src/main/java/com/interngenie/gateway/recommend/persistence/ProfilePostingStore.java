package com.interngenie.gateway.recommend.persistence;

import com.interngenie.gateway.recommend.model.CandidateProfile;
import com.interngenie.gateway.recommend.model.InternshipPosting;

import java.util.List;

/**
 * Read-only access to the data a ranking pass needs. Each call returns a consistent snapshot;
 * callers treat the returned records as immutable.
 */
public interface ProfilePostingStore {

    /**
     * @return the profile, or {@code null} when no candidate has this id
     */
    CandidateProfile findProfileById(long profileId);

    /**
     * @return active postings in id order; empty when none are open
     */
    List<InternshipPosting> findActivePostings();
}
