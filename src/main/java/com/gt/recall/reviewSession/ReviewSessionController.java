package com.gt.recall.reviewSession;

import com.gt.recall.model.GradeResult;
import com.gt.recall.model.RecallGrade;
import com.gt.recall.model.ReviewItem;
import com.gt.recall.model.ReviewSessionStatus;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/rest/review")
public class ReviewSessionController {

    private final ReviewSessionService reviewSessionService;

    public ReviewSessionController(ReviewSessionService reviewSessionService) {
        this.reviewSessionService = reviewSessionService;
    }

    @PostMapping(value = "/startSession", produces = "application/json")
    public ReviewSessionStatus startSession(@AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.startSession(userDetails.getUsername());
    }

    @GetMapping(value = "/currentItem", produces = "application/json")
    public ReviewItem getCurrentItem(@AuthenticationPrincipal UserDetails userDetails,
                                     HttpServletResponse response) {
        Optional<ReviewItem> currentItem = reviewSessionService.currentItem(userDetails.getUsername());
        if (currentItem.isEmpty()) {
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return null;
        }

        return currentItem.get();
    }

    @GetMapping(value = "/status", produces = "application/json")
    public ReviewSessionStatus getSessionStatus(@AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.sessionStatus(userDetails.getUsername());
    }

    @PostMapping(value = "/grade", consumes = "application/json", produces = "application/json")
    public GradeResult submitGrade(@RequestBody SubmitGradeRequest request,
                                   @AuthenticationPrincipal UserDetails userDetails) {
        return reviewSessionService.submitGrade(userDetails.getUsername(), request.itemId(), request.quality());
    }

    @GetMapping(value = "/grades", produces = "application/json")
    public List<GradeOption> getGradeOptions() {
        return Arrays.stream(RecallGrade.values())
                .map(recallGrade -> new GradeOption(recallGrade.name(), recallGrade.getQuality()))
                .toList();
    }

    private record SubmitGradeRequest(String itemId, int quality) { }
    private record GradeOption(String label, int quality) { }
}
