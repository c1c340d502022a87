package com.scholary.diarizer.client;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Builder for multipart/form-data request bodies.
 *
 * <p>Java's HttpClient has no multipart support, so the body is assembled by hand:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="clip.wav"
 * Content-Type: audio/wav
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="language"
 *
 * en
 * --boundary--
 * </pre>
 */
public final class MultipartBody {

  private final String boundary = UUID.randomUUID().toString();
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  /** Add a plain text field. */
  public MultipartBody field(String name, String value) {
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    write(value + "\r\n");
    return this;
  }

  /** Add a file field. */
  public MultipartBody file(String name, String filename, String contentType, byte[] content) {
    write("--" + boundary + "\r\n");
    write(
        "Content-Disposition: form-data; name=\""
            + name
            + "\"; filename=\""
            + filename
            + "\"\r\n");
    write("Content-Type: " + contentType + "\r\n\r\n");
    body.writeBytes(content);
    write("\r\n");
    return this;
  }

  /** Value for the request's Content-Type header. */
  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  /** Close the body and return a publisher over its bytes. */
  public BodyPublisher publisher() {
    ByteArrayOutputStream closed = new ByteArrayOutputStream(body.size() + boundary.length() + 8);
    closed.writeBytes(body.toByteArray());
    closed.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return BodyPublishers.ofByteArray(closed.toByteArray());
  }

  private void write(String text) {
    body.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
