package com.fedivotes.application.port.in;

import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.SortOption;
import com.fedivotes.domain.model.VoteFilter;
import com.fedivotes.domain.model.VoteLedger;

public interface GetVoteLedgerUseCase {

    /**
     * Returns the aggregate counters and the full filtered, sorted vote list of an object.
     *
     * @param authorName optional voter name to restrict to, or null
     * @throws com.fedivotes.infrastructure.exception.ObjectNotFoundException if the URL is unknown locally
     * @throws com.fedivotes.infrastructure.exception.VoteDataSourceException if a read fails
     */
    VoteLedger getVoteLedger(FederatedUrl url, ObjectKind kind, VoteFilter filter, SortOption sort, String authorName);
}
