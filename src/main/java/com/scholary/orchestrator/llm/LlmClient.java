package com.scholary.orchestrator.llm;

import java.io.IOException;

/**
 * Interface for chat-completion calls.
 *
 * <p>Lets the prompt executor be tested without a real model behind it.
 */
public interface LlmClient {

  /**
   * Send one prompt and return the model's reply text.
   *
   * @throws com.scholary.orchestrator.retry.RemoteCallException if the API answers with an error
   *     status
   * @throws IOException on transport or decoding failures
   * @throws InterruptedException if interrupted while waiting for the reply
   */
  String complete(String prompt) throws IOException, InterruptedException;
}
