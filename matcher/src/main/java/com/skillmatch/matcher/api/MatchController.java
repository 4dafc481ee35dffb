package com.skillmatch.matcher.api;

import com.skillmatch.matcher.api.dto.MatchRequest;
import com.skillmatch.matcher.api.dto.MatchResultResponse;
import com.skillmatch.matcher.document.DocumentTextExtractor;
import com.skillmatch.matcher.document.ExtractionFailureException;
import com.skillmatch.matcher.service.MatchService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * REST API for matching.
 *
 * POST /match  : rank jobs for a candidate profile
 * POST /parse  : convert an uploaded resume (PDF or text) to plain text
 * GET  /skills : list the skills the extractor recognises
 */
@RestController
public class MatchController {

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final MatchService          matchService;
    private final DocumentTextExtractor textExtractor;

    public MatchController(MatchService matchService, DocumentTextExtractor textExtractor) {
        this.matchService  = matchService;
        this.textExtractor = textExtractor;
    }

    /**
     * Rank the given jobs for the candidate.
     *
     * Example:
     *   curl -X POST http://localhost:8081/match \
     *     -H "Content-Type: application/json" \
     *     -d '{"candidate":{"raw_text":"I know Rust and Python"},
     *          "jobs":[{"id":"j1","title":"Backend","description":"Looking for a Rust developer"}],
     *          "top_k":5}'
     *
     * HTTP 400: malformed request (see ApiExceptionHandler)
     */
    @PostMapping("/match")
    public List<MatchResultResponse> match(@RequestBody MatchRequest req) {
        return matchService.match(req.toCandidate(), req.toJobPostings(), req.top_k()).stream()
                .map(MatchResultResponse::from)
                .toList();
    }

    /**
     * Extract plain text from an uploaded document.
     *
     * Example:
     *   curl -F file=@resume.pdf http://localhost:8081/parse
     *
     * HTTP 422: the document could not be converted
     */
    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> parse(@RequestParam("file") MultipartFile file) {
        String fileName = file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename();
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new ExtractionFailureException(fileName, "Could not read upload '" + fileName + "'", e);
        }
        String text = textExtractor.extractText(content, fileName, file.getContentType());
        return ResponseEntity.ok().contentType(TEXT_PLAIN_UTF8).body(text);
    }

    @GetMapping("/skills")
    public List<String> skills() {
        return matchService.knownSkills();
    }
}
