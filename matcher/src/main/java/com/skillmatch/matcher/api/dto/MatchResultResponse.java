package com.skillmatch.matcher.api.dto;

import com.skillmatch.matcher.model.MatchResult;

import java.util.List;

/**
 * One entry of the POST /match response.
 * matched_skills is sorted so responses are reproducible byte for byte.
 */
public record MatchResultResponse(
        String       job_id,
        double       score,
        List<String> matched_skills,
        String       explanation
) {
    public static MatchResultResponse from(MatchResult r) {
        return new MatchResultResponse(
                r.jobId(),
                r.score(),
                List.copyOf(r.matchedSkills()),
                r.explanation()
        );
    }
}
