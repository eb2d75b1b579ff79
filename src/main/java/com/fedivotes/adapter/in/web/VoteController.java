package com.fedivotes.adapter.in.web;

import com.fedivotes.application.port.in.GetVoteLedgerUseCase;
import com.fedivotes.application.port.in.VerifyFederatedObjectUseCase;
import com.fedivotes.domain.error.ValidationError;
import com.fedivotes.domain.error.VoteQueryError;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.OffsetPage;
import com.fedivotes.domain.model.PageWindow;
import com.fedivotes.domain.model.SortOption;
import com.fedivotes.domain.model.Vote;
import com.fedivotes.domain.model.VoteFilter;
import com.fedivotes.domain.model.VoteLedger;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/votes")
@Tag(name = "Votes", description = "Vote lookups for federated posts and comments")
public class VoteController {

    private final VerifyFederatedObjectUseCase verifyFederatedObjectUseCase;
    private final GetVoteLedgerUseCase getVoteLedgerUseCase;
    private final AppProperties appProperties;

    public VoteController(
            VerifyFederatedObjectUseCase verifyFederatedObjectUseCase,
            GetVoteLedgerUseCase getVoteLedgerUseCase,
            AppProperties appProperties) {
        this.verifyFederatedObjectUseCase = verifyFederatedObjectUseCase;
        this.getVoteLedgerUseCase = getVoteLedgerUseCase;
        this.appProperties = appProperties;
    }

    @GetMapping("/post")
    @Operation(summary = "Get votes information for a post", description = "Returns a page of votes on the post plus its score totals")
    public ResponseEntity<?> getPostVotes(
            @Parameter(description = "ActivityPub URL of the post", example = "https://lemmy.world/post/4556641")
            @RequestParam(required = false) String url,
            @Parameter(description = "The offset from which to start paginating (0-based)")
            @RequestParam(required = false) Integer offset,
            @Parameter(description = "The maximum number of votes to return per page (1-250)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Vote filter option (All, Upvotes, Downvotes)")
            @RequestParam(name = "votes_filter", required = false) String votesFilter,
            @Parameter(description = "Sort option (datetime_asc, datetime_desc)")
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @Parameter(description = "Only return votes cast by this user name")
            @RequestParam(required = false) String username) {
        return getVotes(ObjectKind.POST, url, offset, limit, votesFilter, sortBy, username);
    }

    @GetMapping("/comment")
    @Operation(summary = "Get votes information for a comment", description = "Returns a page of votes on the comment plus its score totals")
    public ResponseEntity<?> getCommentVotes(
            @Parameter(description = "ActivityPub URL of the comment", example = "https://lemmy.world/comment/1234567")
            @RequestParam(required = false) String url,
            @Parameter(description = "The offset from which to start paginating (0-based)")
            @RequestParam(required = false) Integer offset,
            @Parameter(description = "The maximum number of votes to return per page (1-250)")
            @RequestParam(required = false) Integer limit,
            @Parameter(description = "Vote filter option (All, Upvotes, Downvotes)")
            @RequestParam(name = "votes_filter", required = false) String votesFilter,
            @Parameter(description = "Sort option (datetime_asc, datetime_desc)")
            @RequestParam(name = "sort_by", required = false) String sortBy,
            @Parameter(description = "Only return votes cast by this user name")
            @RequestParam(required = false) String username) {
        return getVotes(ObjectKind.COMMENT, url, offset, limit, votesFilter, sortBy, username);
    }

    private ResponseEntity<?> getVotes(
            ObjectKind kind,
            String url,
            Integer offset,
            Integer limit,
            String votesFilter,
            String sortBy,
            String username) {

        AppProperties.Votes votes = appProperties.getVotes();
        var windowResult = PageWindow.parse(offset, limit, votes.getDefaultPageSize(), votes.getMaxPageSize());
        if (windowResult.isFailure()) {
            return toValidationErrorResponse(windowResult.errorOrNull());
        }
        var filterResult = VoteFilter.parse(votesFilter);
        if (filterResult.isFailure()) {
            return toValidationErrorResponse(filterResult.errorOrNull());
        }
        var sortResult = SortOption.parse(sortBy);
        if (sortResult.isFailure()) {
            return toValidationErrorResponse(sortResult.errorOrNull());
        }

        var urlResult = verifyFederatedObjectUseCase.verify(url, kind);
        if (urlResult.isFailure()) {
            return toErrorResponse(urlResult.errorOrNull());
        }
        FederatedUrl federatedUrl = urlResult.getOrThrow();
        String authorName = username == null || username.isBlank() ? null : username.trim();

        VoteLedger ledger = getVoteLedgerUseCase.getVoteLedger(
            federatedUrl, kind, filterResult.getOrThrow(), sortResult.getOrThrow(), authorName);

        PageWindow window = windowResult.getOrThrow();
        OffsetPage<Vote> page = OffsetPage.slice(ledger.votes(), window.offset(), window.limit());
        return ResponseEntity.ok(VotesResponse.from(ledger.aggregate(), page));
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(VoteQueryError error) {
        HttpStatus status;
        if (error instanceof VoteQueryError.UpstreamRejected rejected) {
            status = upstreamStatus(rejected.status());
        } else if (error instanceof VoteQueryError.UnknownInstance) {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        } else {
            status = HttpStatus.BAD_REQUEST;
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        String requestId = RequestContext.getRequestId();
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), requestId));
    }

    /**
     * Client errors from upstream are passed through; anything else becomes 502.
     */
    private static HttpStatus upstreamStatus(int status) {
        HttpStatus resolved = HttpStatus.resolve(status);
        return resolved != null && resolved.is4xxClientError() ? resolved : HttpStatus.BAD_GATEWAY;
    }

    public record ErrorResponse(String error, String message, String requestId) {}
}
