package com.artgallery.api.review;

import com.artgallery.core.engine.TransactionEngine;
import com.artgallery.core.review.Review;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.artgallery.api.CallerHeaders.CALLER_ID;

@RestController
@RequestMapping("/api/v1/assets/{id}/reviews")
public class ReviewController {

    private final TransactionEngine engine;

    public ReviewController(TransactionEngine engine) {
        this.engine = engine;
    }

    @PostMapping
    public ResponseEntity<Review> addReview(
            @RequestHeader(CALLER_ID) String caller,
            @PathVariable long id,
            @Valid @RequestBody AddReviewRequest request) {
        Review review = engine.addReview(id, request.comment(), request.rating(), caller);
        return ResponseEntity.status(HttpStatus.CREATED).body(review);
    }

    @GetMapping
    public ResponseEntity<List<Review>> getReviews(@PathVariable long id) {
        return ResponseEntity.ok(engine.getReviews(id));
    }

    public record AddReviewRequest(String comment, @NotNull Integer rating) {}
}
