package com.example.file_server.model;

import java.io.IOException;
import java.io.InputStream;

/** An opened stored file. The caller owns {@code stream} and must close it. */
public record StoredFileContent(StoredFile file, InputStream stream) implements AutoCloseable {
  @Override
  public void close() throws IOException {
    stream.close();
  }
}
