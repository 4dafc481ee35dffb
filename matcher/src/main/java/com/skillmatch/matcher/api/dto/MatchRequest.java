package com.skillmatch.matcher.api.dto;

import com.skillmatch.matcher.model.Candidate;
import com.skillmatch.matcher.model.JobPosting;

import java.util.List;

/**
 * Request body for POST /match.
 * Field names are snake_case to match the existing /match wire format.
 *
 * Required: candidate.raw_text, jobs (may be empty), each job's id/title/description
 * Optional: candidate.name, jobs[].required_skills, top_k (null = return all)
 */
public record MatchRequest(
        CandidateInput      candidate,
        List<JobInput>      jobs,
        Integer             top_k
) {

    public record CandidateInput(String name, String raw_text) {
        public Candidate toCandidate() {
            return new Candidate(name, raw_text);
        }
    }

    public record JobInput(String id, String title, String description, List<String> required_skills) {
        public JobPosting toJobPosting() {
            return new JobPosting(id, title, description, required_skills);
        }
    }

    /** Null when the candidate object is missing; validation reports it. */
    public Candidate toCandidate() {
        return candidate == null ? null : candidate.toCandidate();
    }

    /** Null when the jobs array is missing; null entries are kept for validation. */
    public List<JobPosting> toJobPostings() {
        if (jobs == null) return null;
        return jobs.stream()
                .map(j -> j == null ? null : j.toJobPosting())
                .toList();
    }
}
