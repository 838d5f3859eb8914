package de.ialistannen.ocmirror.signing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentMatchers;

class DefaultSignatureStoreClientTest {

  private static final URI REMOTE = URI.create("https://store.example/sha256=abc/signature-1");

  @Test
  void fileStoreCreatesDirectories(@TempDir Path tempDir) throws Exception {
    DefaultSignatureStoreClient client = new DefaultSignatureStoreClient(mock(HttpClient.class));
    URI location = tempDir.resolve("sha256=abc").resolve("signature-1").toUri();

    assertThat(client.get(location)).isEmpty();
    client.put(location, "signed".getBytes(StandardCharsets.UTF_8));

    assertThat(client.get(location)).hasValueSatisfying(
      content -> assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("signed")
    );
  }

  @Test
  void missingRemoteSignatureIsEmpty() throws Exception {
    DefaultSignatureStoreClient client = new DefaultSignatureStoreClient(clientAnswering(404, new byte[0]));

    assertThat(client.get(REMOTE)).isEmpty();
  }

  @Test
  void remoteSignatureIsReturned() throws Exception {
    byte[] signature = {1, 2, 3};
    DefaultSignatureStoreClient client = new DefaultSignatureStoreClient(clientAnswering(200, signature));

    assertThat(client.get(REMOTE)).contains(signature);
  }

  @Test
  void serverErrorsAreNotMistakenForMissingSignatures() throws Exception {
    DefaultSignatureStoreClient client = new DefaultSignatureStoreClient(clientAnswering(503, new byte[0]));

    assertThatThrownBy(() -> client.get(REMOTE))
      .isInstanceOf(SignatureStoreException.class)
      .hasMessageContaining("503");
  }

  private static HttpClient clientAnswering(int status, byte[] body) throws Exception {
    HttpClient httpClient = mock(HttpClient.class);

    @SuppressWarnings("unchecked")
    HttpResponse<byte[]> response = (HttpResponse<byte[]>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);

    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<byte[]>>any()))
      .thenReturn(response);
    return httpClient;
  }
}
