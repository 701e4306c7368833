package io.clype.sqsrelay.transport;

import io.clype.sqsrelay.model.TransportException;

import software.amazon.awssdk.core.SdkResponse;
import software.amazon.awssdk.http.SdkHttpResponse;

/**
 * Status checks shared by the AWS transports.
 */
final class TransportResponses {

    private TransportResponses() {
    }

    /**
     * Fails with {@link TransportException} when the response carries a 4xx or 5xx status.
     */
    static <R extends SdkResponse> R ensureSuccess(String operation, R response) {
        SdkHttpResponse httpResponse = response.sdkHttpResponse();
        if (httpResponse != null && !httpResponse.isSuccessful()) {
            throw new TransportException(operation, httpResponse.statusCode());
        }
        return response;
    }
}
