package com.scholary.podcast.transcript;

import com.scholary.podcast.error.ErrorKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, time-ordered store of transcript chunks for one job.
 *
 * <p>One producer appends while any number of readers take snapshots. A snapshot is an immutable
 * copy, so readers never observe a half-applied append and earlier snapshots are unaffected by
 * later appends.
 *
 * <p>Ordering rules, checked against the last accepted chunk:
 *
 * <ul>
 *   <li>a chunk starting before the last chunk's start is rejected with {@code OVERLAP}
 *   <li>a chunk starting before the last chunk's end is rejected with {@code OUT_OF_ORDER_CHUNK}
 *   <li>any append after {@link #close()} is rejected with {@code BUFFER_CLOSED}
 * </ul>
 */
public class TranscriptBuffer {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<TranscriptChunk> chunks = new ArrayList<>();
  private boolean closed;

  /**
   * Append a chunk.
   *
   * @param chunk the chunk to append
   * @throws TranscriptBufferException if the chunk breaks ordering or the buffer is closed
   */
  public void append(TranscriptChunk chunk) {
    Objects.requireNonNull(chunk, "chunk must not be null");
    lock.writeLock().lock();
    try {
      if (closed) {
        throw new TranscriptBufferException(
            ErrorKind.BUFFER_CLOSED, "Transcript buffer is closed; no further chunks accepted");
      }
      if (!chunks.isEmpty()) {
        TranscriptChunk last = chunks.get(chunks.size() - 1);
        if (chunk.start() < last.start()) {
          throw new TranscriptBufferException(
              ErrorKind.OVERLAP,
              String.format(
                  "Chunk [%.3f-%.3f] starts before previous chunk [%.3f-%.3f]",
                  chunk.start(), chunk.end(), last.start(), last.end()));
        }
        if (chunk.start() < last.end()) {
          throw new TranscriptBufferException(
              ErrorKind.OUT_OF_ORDER_CHUNK,
              String.format(
                  "Chunk [%.3f-%.3f] starts before previous chunk ends at %.3f",
                  chunk.start(), chunk.end(), last.end()));
        }
      }
      chunks.add(chunk);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Returns an immutable, ordered copy of every chunk accepted so far. */
  public List<TranscriptChunk> snapshot() {
    lock.readLock().lock();
    try {
      return List.copyOf(chunks);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Stop accepting chunks. Calling it again has no effect. */
  public void close() {
    lock.writeLock().lock();
    try {
      closed = true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public boolean isClosed() {
    lock.readLock().lock();
    try {
      return closed;
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return chunks.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** End time of the last accepted chunk, or 0 when the buffer is empty. */
  public double lastEndTime() {
    lock.readLock().lock();
    try {
      return chunks.isEmpty() ? 0.0 : chunks.get(chunks.size() - 1).end();
    } finally {
      lock.readLock().unlock();
    }
  }
}
