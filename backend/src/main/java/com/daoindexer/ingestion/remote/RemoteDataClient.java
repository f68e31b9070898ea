package com.daoindexer.ingestion.remote;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Access to on-chain contract state. Calls may be slow and may fail; no retry happens here,
 * callers decide when to try again.
 */
public interface RemoteDataClient {

    /**
     * Connects to the remote API unless already connected.
     *
     * @throws RemoteDataException when the remote API is not reachable yet
     */
    void initIfNeeded();

    /**
     * Decoded state of one contract: {@code {"syncTime": <epoch seconds>, "data": {...}}}.
     *
     * @throws RemoteDataException on any remote failure
     */
    JsonNode getContractData(String address);
}
