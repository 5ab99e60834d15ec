package com.scholary.orchestrator.store;

/** Creates the result store of each pipeline for the configured backend. */
public interface ResultStoreFactory {

  <P, R> ResultStore<P, R> create(String pipeline, Class<P> payloadType, Class<R> resultType);
}
