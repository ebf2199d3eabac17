package com.docqa.rag.service.synthesis;

public interface GenerationClient {

    /**
     * @throws GenerationUnavailableException when the service fails after retries or refuses the request
     */
    GenerationResponse generate(GenerationRequest request);
}
