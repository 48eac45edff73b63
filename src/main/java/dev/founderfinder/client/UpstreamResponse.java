package dev.founderfinder.client;

import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

/** Fully buffered HTTP response, detached from the underlying connection. */
record UpstreamResponse(int status, HttpHeaders headers, byte[] body) {

  static UpstreamResponse read(ClientHttpResponse response) throws IOException {
    return new UpstreamResponse(
        response.getStatusCode().value(),
        HttpHeaders.readOnlyHttpHeaders(response.getHeaders()),
        StreamUtils.copyToByteArray(response.getBody()));
  }
}
