package com.example.honeypot.report;

/**
 * Single delivery attempt to the evaluator's callback endpoint.
 */
public interface CallbackClient {

    /**
     * @return the HTTP status code of the response
     * @throws CallbackTransportException when no response arrived (network error, timeout)
     */
    int post(ReportPayload payload);
}
