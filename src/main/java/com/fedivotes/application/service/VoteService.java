package com.fedivotes.application.service;

import com.fedivotes.application.port.in.GetVoteLedgerUseCase;
import com.fedivotes.application.port.out.AggregateQueryPort;
import com.fedivotes.application.port.out.IdentityQueryPort;
import com.fedivotes.application.port.out.LedgerQueryPort;
import com.fedivotes.application.port.out.MetricsPort;
import com.fedivotes.application.port.out.VoteLedgerRepository.VoteRow;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.SortOption;
import com.fedivotes.domain.model.Vote;
import com.fedivotes.domain.model.VoteAggregate;
import com.fedivotes.domain.model.VoteFilter;
import com.fedivotes.domain.model.VoteLedger;
import com.fedivotes.domain.model.VoteQueryShape;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.config.AsyncConfig;
import com.fedivotes.infrastructure.exception.ObjectNotFoundException;
import com.fedivotes.infrastructure.exception.VoteDataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a federated URL, then reads its aggregate and vote list concurrently.
 * Pagination is left to the caller so the full list can serve other consumers.
 */
@Service
public class VoteService implements GetVoteLedgerUseCase {

    private static final Logger log = LoggerFactory.getLogger(VoteService.class);

    private final IdentityQueryPort identityQueryPort;
    private final AggregateQueryPort aggregateQueryPort;
    private final LedgerQueryPort ledgerQueryPort;
    private final Executor fetchExecutor;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public VoteService(
            IdentityQueryPort identityQueryPort,
            AggregateQueryPort aggregateQueryPort,
            LedgerQueryPort ledgerQueryPort,
            @Qualifier(AsyncConfig.VOTE_FETCH_EXECUTOR) Executor fetchExecutor,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.identityQueryPort = identityQueryPort;
        this.aggregateQueryPort = aggregateQueryPort;
        this.ledgerQueryPort = ledgerQueryPort;
        this.fetchExecutor = fetchExecutor;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public VoteLedger getVoteLedger(FederatedUrl url, ObjectKind kind, VoteFilter filter, SortOption sort, String authorName) {
        log.debug("Fetching votes for {} {}, filter={}, sort={}, author={}",
            kind, url, filter, sort, authorName != null ? "present" : "none");
        metrics.incrementVoteRequests(kind);

        VoteQueryShape shape = VoteQueryShape.of(kind, filter, sort, authorName);

        LocalId localId;
        try {
            localId = identityQueryPort.resolve(url, kind);
        } catch (ObjectNotFoundException e) {
            metrics.incrementObjectsNotFound();
            log.info("No local {} for {}", kind, url);
            throw e;
        }

        VoteLedger ledger = metrics.recordFetchDuration(() -> fetchConcurrently(shape, localId, authorName));
        log.info("Votes served: kind={}, localId={}, votes={}, score={}",
            kind, localId, ledger.totalCount(), ledger.aggregate().totalScore());
        return ledger;
    }

    private VoteLedger fetchConcurrently(VoteQueryShape shape, LocalId localId, String authorName) {
        CompletableFuture<VoteAggregate> aggregateFuture = null;
        CompletableFuture<List<VoteRow>> ledgerFuture;
        try {
            aggregateFuture = CompletableFuture.supplyAsync(
                () -> aggregateQueryPort.fetchAggregate(shape.kind(), localId), fetchExecutor);
            ledgerFuture = CompletableFuture.supplyAsync(
                () -> ledgerQueryPort.fetchVotes(shape, localId, authorName), fetchExecutor);
        } catch (RejectedExecutionException e) {
            if (aggregateFuture != null) {
                aggregateFuture.cancel(true);
            }
            log.warn("Vote fetch pool saturated, rejecting reads for {}", localId);
            throw new VoteDataSourceException("Vote reads for " + localId + " were rejected: fetch pool is saturated", e);
        }

        awaitBoth(aggregateFuture, ledgerFuture, localId);

        List<Vote> votes = ledgerFuture.join().stream()
            .map(VoteService::toVote)
            .toList();
        return new VoteLedger(aggregateFuture.join(), votes);
    }

    /**
     * Waits until both reads succeed. The first failure, a timeout or an interrupt
     * cancels whichever read is still outstanding.
     */
    private void awaitBoth(CompletableFuture<?> first, CompletableFuture<?> second, LocalId localId) {
        CompletableFuture<Void> failFast = new CompletableFuture<>();
        first.whenComplete((value, error) -> failOn(failFast, error));
        second.whenComplete((value, error) -> failOn(failFast, error));
        CompletableFuture.allOf(first, second).thenRun(() -> failFast.complete(null));

        Duration timeout = appProperties.getVotes().getFetchTimeout();
        try {
            failFast.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(first, second);
            throw new VoteDataSourceException("Vote reads for " + localId + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            cancel(first, second);
            Thread.currentThread().interrupt();
            throw new VoteDataSourceException("Interrupted while reading votes for " + localId, e);
        } catch (ExecutionException e) {
            cancel(first, second);
            throw propagate(e.getCause(), localId);
        }
    }

    private static void failOn(CompletableFuture<Void> failFast, Throwable error) {
        if (error != null) {
            failFast.completeExceptionally(error);
        }
    }

    private static void cancel(CompletableFuture<?> first, CompletableFuture<?> second) {
        first.cancel(true);
        second.cancel(true);
    }

    private static RuntimeException propagate(Throwable error, LocalId localId) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof VoteDataSourceException dataSourceException) {
            return dataSourceException;
        }
        if (cause instanceof CancellationException) {
            return new VoteDataSourceException("Vote reads for " + localId + " were cancelled", cause);
        }
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new VoteDataSourceException("Vote reads for " + localId + " failed", cause);
    }

    private static Vote toVote(VoteRow row) {
        return new Vote(row.voterName(), row.score(), row.actorId(), row.published());
    }
}
