package com.scholary.call.transcriber.sync;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local temp file holding the raw interleaved audio of one work unit.
 *
 * <p>Written only by the fan-out stage. The file outlives the buffer: the recording finalizer
 * uploads and then deletes it.
 */
public class RecordingBuffer implements Closeable {

  private final Path path;
  private final OutputStream out;
  private long bytesWritten;
  private boolean closed;

  private RecordingBuffer(Path path, OutputStream out) {
    this.path = path;
    this.out = out;
  }

  /** Create (or truncate) {@code {callId}-{sequence}.raw} under the given directory. */
  public static RecordingBuffer create(Path directory, String callId, int sequence)
      throws IOException {
    Files.createDirectories(directory);
    Path path = directory.resolve(fileName(callId, sequence));
    return new RecordingBuffer(path, new BufferedOutputStream(Files.newOutputStream(path)));
  }

  public static String fileName(String callId, int sequence) {
    return String.format("%s-%d.raw", callId, sequence);
  }

  public synchronized void write(byte[] pcm) throws IOException {
    if (closed) {
      throw new IOException("Recording buffer is closed: " + path);
    }
    out.write(pcm);
    bytesWritten += pcm.length;
  }

  public Path path() {
    return path;
  }

  public synchronized long bytesWritten() {
    return bytesWritten;
  }

  @Override
  public synchronized void close() throws IOException {
    if (!closed) {
      closed = true;
      out.close();
    }
  }
}
