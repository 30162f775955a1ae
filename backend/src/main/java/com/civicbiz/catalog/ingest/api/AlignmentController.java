package com.civicbiz.catalog.ingest.api;

import com.civicbiz.catalog.alignment.AlignmentAxis;
import com.civicbiz.catalog.alignment.AlignmentScale;
import com.civicbiz.catalog.alignment.AlignmentScorer;
import com.civicbiz.catalog.alignment.AlignmentVector;
import com.civicbiz.catalog.ingest.persistence.CatalogJdbcRepository;
import com.civicbiz.catalog.ingest.service.BusinessNotFoundException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/alignment")
public class AlignmentController {
    private final AlignmentScorer scorer;
    private final CatalogJdbcRepository repository;

    public AlignmentController(AlignmentScorer scorer, CatalogJdbcRepository repository) {
        this.scorer = scorer;
        this.repository = repository;
    }

    @PostMapping("/score")
    public AlignmentScoreResponse score(@RequestBody ScoreRequest request) {
        if (request == null || request.user() == null || request.business() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "user and business vectors are required");
        }
        AlignmentVector user = request.user().toVector();
        AlignmentVector business = request.business().toVector();
        return response(user, business);
    }

    @GetMapping("/businesses/{businessId}/users/{userId}")
    public AlignmentScoreResponse storedScore(
        @PathVariable("businessId") long businessId,
        @PathVariable("userId") long userId
    ) {
        AlignmentVector business = repository.findBusinessAlignment(businessId)
            .orElseThrow(() -> new BusinessNotFoundException("No alignment recorded for business " + businessId));
        AlignmentVector user = repository.findUserAlignment(userId)
            .orElseThrow(() -> new BusinessNotFoundException("No alignment recorded for user " + userId));
        return response(user, business);
    }

    private AlignmentScoreResponse response(AlignmentVector user, AlignmentVector business) {
        String lean = scorer.dominantAxis(business).map(AlignmentAxis::key).orElse(null);
        return new AlignmentScoreResponse(scorer.score(user, business), lean);
    }

    public record VectorPayload(String scale, Map<String, Double> weights) {
        AlignmentVector toVector() {
            AlignmentScale parsed = scale == null || scale.isBlank()
                ? AlignmentScale.PERCENT
                : AlignmentScale.valueOf(scale.trim().toUpperCase(Locale.ROOT));
            return AlignmentVector.fromKeys(parsed, weights);
        }
    }

    public record ScoreRequest(VectorPayload user, VectorPayload business) {
    }

    public record AlignmentScoreResponse(int score, String dominantLean) {
    }
}
