/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reputation.integration.ledger;

import io.smallrye.mutiny.Multi;
import villagecompute.reputation.api.types.LedgerEventFilterType;
import villagecompute.reputation.api.types.LedgerEventType;
import villagecompute.reputation.api.types.LedgerStateQueryType;
import villagecompute.reputation.api.types.LedgerStateResultType;
import villagecompute.reputation.api.types.LedgerTransactionRequestType;
import villagecompute.reputation.api.types.LedgerTransactionResultType;

/**
 * Boundary to the distributed ledger.
 *
 * <p>
 * Implementations return canonical types only; raw response shapes are normalized inside the adapter by
 * {@link LedgerResponseNormalizer}. All calls block the calling thread.
 *
 * <p>
 * <b>Failure contract:</b>
 * <ul>
 * <li>Network errors and timeouts throw {@link villagecompute.reputation.exceptions.LedgerUnavailableException}</li>
 * <li>Interruption of the calling thread is treated as cancellation: the interrupt flag is restored and
 * {@code LedgerUnavailableException} is thrown</li>
 * <li>A ledger-side rejection of a transaction is not an exception: it is a result with status
 * {@code FAILED}</li>
 * </ul>
 */
public interface LedgerAdapter {

    /**
     * Submits a contract call.
     *
     * @param request
     *            transaction to submit
     * @return normalized result; callers must treat anything but {@code CONFIRMED} as not applied
     */
    LedgerTransactionResultType submitTransaction(LedgerTransactionRequestType request);

    /**
     * Queries contract state.
     *
     * @param query
     *            contract, method and parameters
     * @return normalized state; empty when the ledger holds nothing for the query
     */
    LedgerStateResultType queryState(LedgerStateQueryType query);

    /**
     * Streams contract events matching the filter. The stream fails with {@code LedgerUnavailableException} when the
     * ledger becomes unreachable; re-subscribing is up to the subscriber.
     *
     * @param filter
     *            addresses and topics to watch
     * @return hot stream of events
     */
    Multi<LedgerEventType> watchEvents(LedgerEventFilterType filter);
}
