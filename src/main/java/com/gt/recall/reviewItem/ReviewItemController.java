package com.gt.recall.reviewItem;

import com.gt.recall.delete.DeletionService;
import com.gt.recall.model.ReviewItem;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/reviewItem")
public class ReviewItemController {

    private final ReviewItemService reviewItemService;
    private final DeletionService deletionService;

    @Autowired
    public ReviewItemController(ReviewItemService reviewItemService, DeletionService deletionService) {
        this.reviewItemService = reviewItemService;
        this.deletionService = deletionService;
    }

    @PostMapping(value = "/create", consumes = "application/json", produces = "application/json")
    public ReviewItem createReviewItem(@RequestBody CreateReviewItemRequest request,
                                       @AuthenticationPrincipal UserDetails userDetails,
                                       HttpServletResponse response) {
        ReviewItem reviewItem = reviewItemService.createItem(userDetails.getUsername(), request.title(), request.content());

        response.setStatus(HttpServletResponse.SC_ACCEPTED);
        return reviewItem;
    }

    @GetMapping(value = "/item", produces = "application/json")
    public ReviewItem getReviewItem(@RequestParam(value = "id") String itemId,
                                    @AuthenticationPrincipal UserDetails userDetails) {
        return reviewItemService.getItem(userDetails.getUsername(), itemId);
    }

    @GetMapping(value = "/allItems", produces = "application/json")
    public List<ReviewItem> getAllReviewItems(@AuthenticationPrincipal UserDetails userDetails) {
        return reviewItemService.listItems(userDetails.getUsername());
    }

    @GetMapping(value = "/dueCount", produces = "application/json")
    public int getDueCount(@AuthenticationPrincipal UserDetails userDetails) {
        return reviewItemService.dueCount(userDetails.getUsername());
    }

    @PostMapping(value = "/delete")
    public void deleteReviewItem(@RequestBody String itemId,
                                 @AuthenticationPrincipal UserDetails userDetails) {
        deletionService.deleteReviewItem(userDetails.getUsername(), itemId.trim());
    }

    private record CreateReviewItemRequest(String title, String content) { }
}
