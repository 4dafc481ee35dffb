package com.skillmatch.matcher.service;

import com.skillmatch.matcher.model.Candidate;
import com.skillmatch.matcher.model.JobPosting;
import com.skillmatch.matcher.model.MatchResult;
import com.skillmatch.matcher.model.ValidationException;
import com.skillmatch.matcher.ranking.Ranker;
import com.skillmatch.matcher.scoring.SimilarityScorer;
import com.skillmatch.matcher.scoring.SkillScore;
import com.skillmatch.matcher.skill.SkillExtractor;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs one match request: one candidate against N jobs.
 *
 * Steps:
 *  1. Validate the whole request; nothing is extracted or scored if it is malformed
 *  2. Extract the candidate's skills once
 *  3. Fan out: score every job on the scoring pool (declared ∪ extracted skills)
 *  4. Fan in: wait for all jobs, then rank on the calling thread
 *
 * Ranking always runs after the join, so the order in which workers finish
 * never shows in the result.
 */
@Service
public class MatchService {

    private static final Logger log = LoggerFactory.getLogger(MatchService.class);

    private final SkillExtractor   extractor;
    private final SimilarityScorer scorer;
    private final ExecutorService  scoringPool;
    private final MeterRegistry    meterRegistry;

    public MatchService(SkillExtractor extractor,
                        SimilarityScorer scorer,
                        @Qualifier("scoringPool") ExecutorService scoringPool,
                        MeterRegistry meterRegistry) {
        this.extractor     = extractor;
        this.scorer        = scorer;
        this.scoringPool   = scoringPool;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Match
    // ------------------------------------------------------------------

    /**
     * Score every job for the candidate and return them best-first.
     *
     * Metrics:
     * <pre>
     *   skillmatch.match.requests{status="success|validation_failed|error"}
     *   skillmatch.match.duration{status}
     *   skillmatch.match.jobs   (jobs per request)
     * </pre>
     *
     * @param topK Maximum results to return; null returns all.
     * @throws ValidationException if the request is malformed
     */
    public List<MatchResult> match(Candidate candidate, List<JobPosting> jobs, Integer topK) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            validate(candidate, jobs, topK);

            SortedSet<String> candidateSkills = extractor.extract(candidate.rawText());
            log.debug("Candidate '{}' skills: {}", displayName(candidate), candidateSkills);

            List<MatchResult> scored = scoreAll(candidateSkills, jobs);
            List<MatchResult> ranked = Ranker.rank(scored, topK);

            DistributionSummary.builder("skillmatch.match.jobs")
                    .register(meterRegistry)
                    .record(jobs.size());
            log.info("Matched candidate '{}' ({} skills) against {} jobs, returning {}",
                    displayName(candidate), candidateSkills.size(), jobs.size(), ranked.size());
            return ranked;
        } catch (ValidationException e) {
            status = "validation_failed";
            log.warn("Rejected match request: {}", e.getMessage());
            throw e;
        } catch (RuntimeException | Error e) {
            status = "error";
            log.error("Match request failed for candidate '{}'", displayName(candidate), e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("skillmatch.match.duration", "status", status));
            meterRegistry.counter("skillmatch.match.requests", "status", status).increment();
        }
    }

    /**
     * Score a single job against an already extracted candidate skill set.
     * Runs on a scoring worker thread.
     */
    public MatchResult scoreJob(SortedSet<String> candidateSkills, JobPosting job) {
        SortedSet<String> jobSkills = jobSkills(job);
        SkillScore score = scorer.score(candidateSkills, jobSkills);
        log.debug("Job '{}' skills={} matched={} score={}",
                job.id(), jobSkills, score.matched(), score.composite());
        return new MatchResult(job.id(), score.composite(), score.matched(), score.explanation());
    }

    /** Declared skills (normalised) ∪ skills extracted from the description. */
    public SortedSet<String> jobSkills(JobPosting job) {
        SortedSet<String> skills = new TreeSet<>(job.normalizedRequiredSkills());
        skills.addAll(extractor.extract(job.description()));
        return Collections.unmodifiableSortedSet(skills);
    }

    /** Names of all patterns the extractor recognises (sorted). */
    public List<String> knownSkills() {
        return extractor.catalog().skillNames();
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    /**
     * Reject a malformed request as a whole.
     *
     * @throws ValidationException naming the first violated constraint
     */
    public static void validate(Candidate candidate, List<JobPosting> jobs, Integer topK) {
        if (candidate == null) {
            throw new ValidationException("candidate", "is required");
        }
        if (candidate.rawText() == null) {
            throw new ValidationException("candidate.raw_text", "is required (may be empty)");
        }
        if (jobs == null) {
            throw new ValidationException("jobs", "is required (may be empty)");
        }
        for (int i = 0; i < jobs.size(); i++) {
            JobPosting job = jobs.get(i);
            String path = "jobs[" + i + "]";
            if (job == null) {
                throw new ValidationException(path, "must not be null");
            }
            if (job.id() == null) {
                throw new ValidationException(path + ".id", "is required");
            }
            if (job.title() == null) {
                throw new ValidationException(path + ".title", "is required");
            }
            if (job.description() == null) {
                throw new ValidationException(path + ".description", "is required (may be empty)");
            }
        }
        Ranker.requireValidTopK(topK);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<MatchResult> scoreAll(SortedSet<String> candidateSkills, List<JobPosting> jobs) {
        List<CompletableFuture<MatchResult>> pending = new ArrayList<>(jobs.size());
        for (JobPosting job : jobs) {
            pending.add(CompletableFuture.supplyAsync(() -> scoreJob(candidateSkills, job), scoringPool));
        }
        List<MatchResult> results = new ArrayList<>(pending.size());
        for (CompletableFuture<MatchResult> f : pending) {
            results.add(join(f));
        }
        return results;
    }

    /** Join a scoring task, rethrowing the worker's own exception. */
    private static MatchResult join(CompletableFuture<MatchResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Scoring task failed", cause);
        }
    }

    private static String displayName(Candidate candidate) {
        return candidate == null || candidate.name() == null || candidate.name().isBlank()
                ? "<anonymous>" : candidate.name();
    }
}
