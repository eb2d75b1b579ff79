package com.fedivotes.adapter.in.web;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fedivotes.domain.model.OffsetPage;
import com.fedivotes.domain.model.Vote;
import com.fedivotes.domain.model.VoteAggregate;

import java.util.List;

/**
 * One page of votes plus the object's score totals, serialized in snake_case.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record VotesResponse(
    List<VoteResponse> votes,
    int totalCount,
    Integer nextOffset,
    long totalScore,
    long upvotes,
    long downvotes
) {
    public static VotesResponse from(VoteAggregate aggregate, OffsetPage<Vote> page) {
        List<VoteResponse> votes = page.items().stream().map(VoteResponse::from).toList();
        return new VotesResponse(
            votes,
            page.totalCount(),
            page.nextOffset(),
            aggregate.totalScore(),
            aggregate.upvotes(),
            aggregate.downvotes()
        );
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VoteResponse(
        String name,
        int score,
        String actorId,
        double createdUtc
    ) {
        public static VoteResponse from(Vote vote) {
            return new VoteResponse(vote.voterName(), vote.score(), vote.actorId(), vote.createdUtc());
        }
    }
}
